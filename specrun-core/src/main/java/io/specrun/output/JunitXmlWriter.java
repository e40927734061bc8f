/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.specrun.output;

import io.specrun.core.Example;
import io.specrun.core.ExampleResult;
import io.specrun.core.SuiteResult;
import org.slf4j.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Writes a JUnit XML report that CI systems (Jenkins, GitHub Actions, etc.) understand.
 * <pre>
 * &lt;testsuite name="specrun" tests="N" failures="N" errors="N" skipped="N" time="secs"&gt;
 *   &lt;testcase classname="Calc" name="adds" time="secs"/&gt;
 *   &lt;testcase classname="Calc" name="subs" time="secs"&gt;
 *     &lt;failure message="nope" type="io.specrun.core.AssertionFailure"&gt;stacktrace&lt;/failure&gt;
 *   &lt;/testcase&gt;
 * &lt;/testsuite&gt;
 * </pre>
 */
public final class JunitXmlWriter {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private JunitXmlWriter() {
    }

    /**
     * Write the report. Failures to write are logged, never thrown.
     *
     * @param result the finished run
     * @param file   the xml file to (over)write, parent directories are created
     */
    public static void write(SuiteResult result, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toXml(result));
            logger.debug("junit xml written: {}", file);
        } catch (Exception e) {
            logger.warn("failed to write junit xml to {}: {}", file, e.getMessage());
        }
    }

    public static String toXml(SuiteResult result) {
        DecimalFormat formatter = (DecimalFormat) NumberFormat.getNumberInstance(Locale.US);
        formatter.applyPattern("0.######");

        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<testsuite");
        xml.append(" name=\"specrun\"");
        xml.append(" tests=\"").append(result.getExampleCount()).append("\"");
        xml.append(" failures=\"").append(result.getFailCount()).append("\"");
        xml.append(" errors=\"").append(result.getErrorCount()).append("\"");
        xml.append(" skipped=\"").append(result.getPendingCount()).append("\"");
        xml.append(" time=\"").append(formatter.format(result.getDurationMillis() / 1000.0)).append("\"");
        xml.append(">\n");
        for (ExampleResult er : result.getResults()) {
            writeTestcase(xml, er, formatter);
        }
        xml.append("</testsuite>\n");
        return xml.toString();
    }

    private static void writeTestcase(StringBuilder xml, ExampleResult er, DecimalFormat formatter) {
        Example example = er.getExample();
        String classname = example.getParent() == null ? "" : example.getParent().getPath();
        if (classname.isEmpty()) {
            classname = example.getLocation().file();
        }
        xml.append("  <testcase");
        xml.append(" classname=\"").append(escape(classname)).append("\"");
        xml.append(" name=\"").append(escape(example.getDescription())).append("\"");
        xml.append(" time=\"").append(formatter.format(er.getDurationMillis() / 1000.0)).append("\"");
        xml.append(">");
        switch (er.getOutcome()) {
            case FAIL -> writeProblem(xml, "failure", er);
            case ERROR -> writeProblem(xml, "error", er);
            case PENDING -> xml.append("<skipped/>");
            default -> {
            }
        }
        String log = er.getLog();
        if (log != null && !log.isEmpty()) {
            xml.append("<system-out>").append(escape(log)).append("</system-out>");
        }
        xml.append("</testcase>\n");
    }

    private static void writeProblem(StringBuilder xml, String element, ExampleResult er) {
        Throwable error = er.getError();
        xml.append("<").append(element);
        xml.append(" message=\"").append(escape(truncate(er.getMessage(), 1000))).append("\"");
        xml.append(" type=\"").append(escape(error.getClass().getName())).append("\"");
        xml.append(">");
        xml.append(escape(er.getFailureLocation() + "\n" + getStackTrace(error)));
        xml.append("</").append(element).append(">");
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }

    private static String getStackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

}
