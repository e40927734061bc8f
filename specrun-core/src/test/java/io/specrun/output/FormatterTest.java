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
import io.specrun.core.Example;
import io.specrun.core.Outcome;
import io.specrun.core.PassingSpec;
import io.specrun.core.SourceLocation;
import io.specrun.core.Spec;
import io.specrun.core.SpecBuilder;
import io.specrun.core.Suite;
import io.specrun.core.SuiteResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

class FormatterTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    @BeforeEach
    void setup() {
        Console.setColorsEnabled(false);
        Console.setOutput(new PrintStream(out, true));
    }

    @AfterEach
    void cleanup() {
        Console.setOutput(System.out);
    }

    private String output() {
        return out.toString().replace("\r\n", "\n");
    }

    @Test
    void testDotFormatterLetters() {
        SpecBuilder spec = new SpecBuilder();
        spec.it("ok", () -> {
        });
        spec.it("fails", () -> Spec.fail("nope", "F.java", 1));
        spec.it("errors", () -> {
            throw new IllegalStateException("boom");
        });
        spec.pending("later", () -> {
        });
        Suite.of(spec.build()).formatter(new DotFormatter()).run();
        assertTrue(output().startsWith(".FE*\n"), output());
    }

    @Test
    void testSummaryListsFailuresInOrderWithLocation() {
        SpecBuilder spec = new SpecBuilder();
        spec.describe("Calc", () -> {
            spec.it("errors", SourceLocation.of("CalcSpec.java", 10), () -> {
                throw new IllegalStateException("boom");
            });
            spec.it("subs", SourceLocation.of("CalcSpec.java", 11), () -> Spec.fail("nope", "CalcSpec.java", 12));
        });
        SuiteResult result = Suite.of(spec.build()).formatter(new DotFormatter()).run();
        String text = output();
        assertFalse(result.isPassed());
        int first = text.indexOf("1) Calc errors");
        int second = text.indexOf("2) Calc subs");
        assertTrue(first > 0 && second > first, text);
        assertTrue(text.contains("java.lang.IllegalStateException: boom"));
        assertTrue(text.contains("# CalcSpec.java:10"));
        assertTrue(text.contains("     nope\n"));
        assertTrue(text.contains("# CalcSpec.java:12"));
        assertTrue(text.contains("Finished in "));
        assertTrue(text.contains("2 examples, 1 failures, 1 errors, 0 pending"));
        assertTrue(text.contains("specrun -l 10 # Calc errors"));
        assertTrue(text.contains("specrun -l 11 # Calc subs"));
    }

    @Test
    void testSummaryForPassingRun() {
        Suite.of(new PassingSpec()).formatter(new DotFormatter()).run();
        String text = output();
        assertTrue(text.contains("Pending:\n  Strings when empty trims"));
        assertTrue(text.contains("3 examples, 0 failures, 0 errors, 1 pending"));
        assertFalse(text.contains("Failures:"));
        assertFalse(text.contains("Failed examples:"));
    }

    @Test
    void testSummaryMentionsAbort() {
        Suite.of(new CalcSpec(), new CalcSpec()).failFast(true).formatter(new DotFormatter()).run();
        assertTrue(output().contains("Aborted"));
    }

    @Test
    void testVerboseFormatterPrintsTree() {
        Suite.of(new PassingSpec()).formatter(new VerboseFormatter()).run();
        assertTrue(output().startsWith("""
                Strings
                  concatenates
                  when empty
                    has zero length
                    trims
                """), output());
    }

    @Test
    void testVerboseFormatterReprintsOnlyNewGroups() {
        SpecBuilder spec = new SpecBuilder();
        spec.describe("A", () -> {
            spec.describe("B", () -> spec.it("one", () -> {
            }));
            spec.describe("B", () -> spec.it("two", () -> {
            }));
        });
        spec.it("top", () -> {
        });
        Suite.of(spec.build()).formatter(new VerboseFormatter()).run();
        assertTrue(output().startsWith("""
                A
                  B
                    one
                  B
                    two
                top
                """), output());
    }

    @Test
    void testColors() {
        Console.setColorsEnabled(true);
        Suite.of(new CalcSpec()).formatter(new DotFormatter()).run();
        String text = output();
        assertTrue(text.startsWith(Console.GREEN + "." + Console.RESET + Console.RED + "F" + Console.RESET));
        Console.setColorsEnabled(false);
        assertEquals("plain", Console.outcome("plain", Outcome.FAIL));
        assertEquals("x", Console.stripAnsi(Console.GREEN + "x" + Console.RESET));
    }

    @Test
    void testRerunCommandNamesTheSpecClass() {
        Example subs = Spec.tree(new CalcSpec()).getExamples().get(1);
        assertEquals(CalcSpec.class.getName(), subs.getSpecClass());
        Suite.of(new CalcSpec()).formatter(new DotFormatter()).run();
        assertTrue(output().contains("specrun -l " + subs.getLocation().line() + " io.specrun.core.CalcSpec # Calc subs"),
                output());
    }

    @Test
    void testRerunCommandWithoutSpecClassForLambdaDefinition() {
        Suite.of(spec -> spec.it("lambda", SourceLocation.of("L.java", 5), () -> Spec.fail("no")))
                .formatter(new DotFormatter())
                .run();
        assertTrue(output().contains("specrun -l 5 # lambda"), output());
    }

    @Test
    void testErrorWithoutMessageShowsClassName() {
        SpecBuilder spec = new SpecBuilder();
        spec.it("no message", () -> {
            throw new IllegalStateException();
        });
        Suite.of(spec.build()).formatter(new DotFormatter()).run();
        String text = output();
        assertTrue(text.contains("     java.lang.IllegalStateException\n"), text);
        assertFalse(text.contains(": null"), text);
    }

}
