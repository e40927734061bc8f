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

import io.specrun.core.CalcSpec;
import io.specrun.core.SpecBuilder;
import io.specrun.core.Suite;
import io.specrun.core.SuiteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JunitXmlWriterTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setup() {
        Console.setColorsEnabled(false);
    }

    @Test
    void testJunitXmlWithFailure() throws Exception {
        Path xmlPath = tempDir.resolve("reports/specrun-junit.xml");
        SuiteResult result = Suite.of(new CalcSpec()).junitXml(xmlPath).run();
        assertFalse(result.isPassed());

        assertTrue(Files.exists(xmlPath), "JUnit XML file should exist");
        String xml = Files.readString(xmlPath);
        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"));
        assertTrue(xml.contains("<testsuite name=\"specrun\" tests=\"2\" failures=\"1\" errors=\"0\" skipped=\"0\""));
        assertTrue(xml.contains("<testcase classname=\"Calc\" name=\"adds\""));
        assertTrue(xml.contains("<testcase classname=\"Calc\" name=\"subs\""));
        assertTrue(xml.contains("<failure message=\"nope\" type=\"io.specrun.core.AssertionFailure\">CalcSpec.java:42"));
        assertTrue(xml.contains("</testsuite>"));
    }

    @Test
    void testErrorSkippedLogAndEscaping() {
        SpecBuilder spec = new SpecBuilder();
        spec.describe("<Tags> & \"quotes\"", () -> {
            spec.it("errors", () -> {
                LogContext.get().log("about to fail");
                throw new IllegalArgumentException("bad <arg>");
            });
            spec.pending("later", () -> {
            });
        });
        spec.it("top level", () -> {
        });
        String xml = JunitXmlWriter.toXml(Suite.of(spec.build()).run());
        assertTrue(xml.contains("classname=\"&lt;Tags&gt; &amp; &quot;quotes&quot;\""));
        assertTrue(xml.contains("<error message=\"bad &lt;arg&gt;\" type=\"java.lang.IllegalArgumentException\">"));
        assertTrue(xml.contains("<system-out>about to fail</system-out>"));
        assertTrue(xml.contains("<skipped/>"));
        assertTrue(xml.contains("classname=\"JunitXmlWriterTest.java\" name=\"top level\""));
        assertTrue(xml.contains("errors=\"1\""));
        assertTrue(xml.contains("skipped=\"1\""));
    }

}
