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

import io.specrun.core.AssertionFailure;
import io.specrun.core.Example;
import io.specrun.core.ExampleResult;
import io.specrun.core.Outcome;
import io.specrun.core.SuiteResult;

import java.util.List;
import java.util.Locale;

/**
 * Summary rendering shared by the console formatters.
 * <pre>
 * Failures:
 *
 *   1) Calc subs
 *      nope
 *      # CalcSpec.java:14
 *
 * Finished in 0.004 seconds
 * 2 examples, 1 failures, 0 errors, 0 pending
 *
 * Failed examples:
 *
 * specrun -l 14 com.example.CalcSpec # Calc subs
 * </pre>
 */
public abstract class ConsoleFormatter implements Formatter {

    @Override
    public void reportSummary(SuiteResult result) {
        Console.println();
        printPending(result.getPending());
        printFailures(result.getFailures());
        if (result.isAborted()) {
            Console.println(Console.warn("Aborted: remaining examples were not run"));
            Console.println();
        }
        double seconds = result.getDurationMillis() / 1000.0;
        Console.println(String.format(Locale.US, "Finished in %.3f seconds", seconds));
        String counts = result.getExampleCount() + " examples, "
                + result.getFailCount() + " failures, "
                + result.getErrorCount() + " errors, "
                + result.getPendingCount() + " pending";
        Console.println(result.isPassed() ? Console.pass(counts) : Console.red(counts));
        printRerunCommands(result.getFailures());
    }

    private void printPending(List<ExampleResult> pending) {
        if (pending.isEmpty()) {
            return;
        }
        Console.println("Pending:");
        for (ExampleResult pr : pending) {
            Console.println(Console.yellow("  " + pr.getExample().getPath()));
        }
        Console.println();
    }

    private void printFailures(List<ExampleResult> failures) {
        if (failures.isEmpty()) {
            return;
        }
        Console.println("Failures:");
        int index = 1;
        for (ExampleResult fr : failures) {
            Console.println();
            Console.println("  " + index++ + ") " + fr.getExample().getPath());
            Console.println();
            Console.println(Console.red(indent(describeError(fr))));
            for (Throwable t : fr.getAfterHookErrors()) {
                if (t != fr.getError()) {
                    Console.println(Console.red(indent("after-each: " + t)));
                }
            }
            Console.println(Console.cyan("     # " + fr.getFailureLocation()));
        }
        Console.println();
    }

    private void printRerunCommands(List<ExampleResult> failures) {
        if (failures.isEmpty()) {
            return;
        }
        Console.println();
        Console.println("Failed examples:");
        Console.println();
        for (ExampleResult fr : failures) {
            Example example = fr.getExample();
            String command = "specrun -l " + example.getLocation().line();
            if (example.getSpecClass() != null) {
                command = command + " " + example.getSpecClass();
            }
            Console.println(Console.red(command) + " " + Console.cyan("# " + example.getPath()));
        }
    }

    private static String describeError(ExampleResult result) {
        Throwable error = result.getError();
        if (result.getOutcome() == Outcome.FAIL && error instanceof AssertionFailure) {
            return result.getMessage();
        }
        String message = error.getMessage();
        return message == null ? error.getClass().getName() : error.getClass().getName() + ": " + message;
    }

    private static String indent(String text) {
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("     ").append(line);
        }
        return sb.toString();
    }

}
