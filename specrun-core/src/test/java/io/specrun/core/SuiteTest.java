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
package io.specrun.core;

import io.specrun.output.Console;
import io.specrun.output.Formatter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SuiteTest {

    private final List<String> calls = new ArrayList<>();

    @BeforeEach
    void setup() {
        Console.setColorsEnabled(false);
        Console.setOutput(new PrintStream(new ByteArrayOutputStream()));
    }

    @AfterEach
    void cleanup() {
        Console.setOutput(System.out);
    }

    private SpecTree threeExamples() {
        SpecBuilder spec = new SpecBuilder();
        spec.describe("Suite", () -> {
            spec.it("first", SourceLocation.of("S.java", 3), () -> {
                calls.add("first");
                Spec.fail("first failed", "S.java", 4);
            });
            spec.it("second", SourceLocation.of("S.java", 6), () -> calls.add("second"));
            spec.it("third", SourceLocation.of("S.java", 7), () -> calls.add("third"));
        });
        return spec.build();
    }

    @Test
    void testCalcScenario() {
        SuiteResult result = Suite.of(new CalcSpec()).run();
        assertEquals(1, result.getSuccessCount());
        assertEquals(1, result.getFailCount());
        assertEquals(0, result.getErrorCount());
        assertFalse(result.isPassed());
        assertEquals(1, result.getExitCode());
        ExampleResult failure = result.getFailures().get(0);
        assertEquals("Calc subs", failure.getExample().getPath());
        assertEquals("nope", failure.getMessage());
        assertEquals(SourceLocation.of("CalcSpec.java", 42), failure.getFailureLocation());
    }

    @Test
    void testWalkIsDepthFirstInDeclarationOrder() {
        SpecBuilder spec = new SpecBuilder();
        spec.it("1", () -> calls.add("1"));
        spec.describe("A", () -> {
            spec.it("2", () -> calls.add("2"));
            spec.describe("B", () -> spec.it("3", () -> calls.add("3")));
            spec.it("4", () -> calls.add("4"));
        });
        spec.it("5", () -> calls.add("5"));
        SuiteResult result = Suite.of(spec.build()).run();
        assertEquals(List.of("1", "2", "3", "4", "5"), calls);
        List<String> reported = new ArrayList<>();
        for (ExampleResult er : result.getResults()) {
            reported.add(er.getExample().getDescription());
        }
        assertEquals(calls, reported);
    }

    @Test
    void testFailFastSkipsRemainingExamples() {
        SuiteResult result = Suite.of(threeExamples()).failFast(true).run();
        assertEquals(List.of("first"), calls);
        assertEquals(1, result.getExampleCount());
        assertEquals(1, result.getFailCount());
        assertEquals(0, result.getSuccessCount());
        assertTrue(result.isAborted());
    }

    @Test
    void testWithoutFailFastEverythingRuns() {
        SuiteResult result = Suite.of(threeExamples()).run();
        assertEquals(List.of("first", "second", "third"), calls);
        assertEquals(3, result.getExampleCount());
        assertFalse(result.isAborted());
    }

    @Test
    void testFailFastIgnoresPending() {
        SpecBuilder spec = new SpecBuilder();
        spec.pending("later", () -> {
        });
        spec.it("runs", () -> calls.add("runs"));
        SuiteResult result = Suite.of(spec.build()).failFast(true).run();
        assertEquals(List.of("runs"), calls);
        assertEquals(1, result.getPendingCount());
        assertTrue(result.isPassed());
    }

    @Test
    void testFilterSelectsByPattern() {
        SuiteResult result = Suite.of(threeExamples()).filter(RunFilter.pattern("Suite sec")).run();
        assertEquals(List.of("second"), calls);
        assertEquals(1, result.getExampleCount());
        assertTrue(result.isPassed());
    }

    @Test
    void testFilterSelectsByLine() {
        SuiteResult result = Suite.of(threeExamples()).filter(RunFilter.of("first", 7)).run();
        assertEquals(List.of("first", "third"), calls);
        assertEquals(2, result.getExampleCount());
    }

    @Test
    void testFilteredOutExamplesAreNotReported() {
        List<String> started = new ArrayList<>();
        Suite.of(threeExamples())
                .filter(RunFilter.line(6))
                .resultListener(new ResultListener() {
                    @Override
                    public void onExampleStart(Example example) {
                        started.add(example.getDescription());
                    }
                })
                .run();
        assertEquals(List.of("second"), started);
    }

    @Test
    void testAbortBeforeRunSkipsEverything() {
        Suite suite = Suite.of(threeExamples());
        suite.abort();
        SuiteResult result = suite.run();
        assertTrue(calls.isEmpty());
        assertEquals(0, result.getExampleCount());
        assertTrue(result.isPassed());
        assertTrue(result.isAborted());
    }

    @Test
    void testAbortDuringExampleLetsItFinish() {
        Suite[] holder = new Suite[1];
        SpecBuilder spec = new SpecBuilder();
        spec.it("aborts", () -> {
            holder[0].abort();
            calls.add("still running");
        });
        spec.it("skipped", () -> calls.add("skipped"));
        holder[0] = Suite.of(spec.build());
        SuiteResult result = holder[0].run();
        assertEquals(List.of("still running"), calls);
        assertEquals(1, result.getSuccessCount());
        assertEquals(1, result.getExampleCount());
    }

    @Test
    void testAbortFromAnotherThread() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch aborted = new CountDownLatch(1);
        Suite[] holder = new Suite[1];
        SpecBuilder spec = new SpecBuilder();
        spec.it("waits", () -> {
            started.countDown();
            assertTrue(aborted.await(5, TimeUnit.SECONDS));
        });
        spec.it("never", () -> calls.add("never"));
        holder[0] = Suite.of(spec.build());
        Thread signal = new Thread(() -> {
            try {
                started.await();
                holder[0].abort();
                aborted.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        signal.start();
        SuiteResult result = holder[0].run();
        signal.join();
        assertTrue(calls.isEmpty());
        assertEquals(1, result.getExampleCount());
        assertTrue(holder[0].isAborted());
    }

    @Test
    void testNoExceptionEscapesTheWalk() {
        SpecBuilder spec = new SpecBuilder();
        spec.it("error", () -> {
            throw new OutOfMemoryError("simulated");
        });
        spec.it("after", () -> calls.add("after"));
        SuiteResult result = Suite.of(spec.build()).run();
        assertEquals(1, result.getErrorCount());
        assertEquals(List.of("after"), calls);
    }

    @Test
    void testListenerLifecycle() {
        List<String> events = new ArrayList<>();
        ResultListener listener = new ResultListener() {
            @Override
            public void onSuiteStart(Suite suite) {
                events.add("suiteStart");
            }

            @Override
            public void onSuiteEnd(SuiteResult result) {
                events.add("suiteEnd:" + result.getExampleCount());
            }

            @Override
            public void onExampleStart(Example example) {
                events.add("start:" + example.getDescription());
            }

            @Override
            public void onExampleEnd(ExampleResult result) {
                events.add("end:" + result.getExample().getDescription() + ":" + result.getOutcome());
            }
        };
        Suite.of(new CalcSpec()).resultListener(listener).run();
        assertEquals(List.of(
                "suiteStart",
                "start:adds", "end:adds:SUCCESS",
                "start:subs", "end:subs:FAIL",
                "suiteEnd:2"), events);
    }

    @Test
    void testSameTreeRunsTwiceInOneProcess() {
        SpecTree tree = threeExamples();
        SuiteResult first = Suite.of(tree).failFast(true).run();
        SuiteResult second = Suite.of(tree).run();
        assertEquals(1, first.getExampleCount());
        assertEquals(3, second.getExampleCount());
    }

    @Test
    void testSuiteRunsOnlyOnce() {
        Suite suite = Suite.of(new CalcSpec());
        suite.run();
        assertThrows(SpecException.class, suite::run);
    }

    @Test
    void testElapsedTime() {
        SpecBuilder spec = new SpecBuilder();
        spec.it("sleeps", () -> Thread.sleep(20));
        SuiteResult result = Suite.of(spec.build()).run();
        assertTrue(result.getDurationMillis() >= 20);
    }

    @Test
    void testThrowingListenerDoesNotChangeTheRun() {
        ResultListener broken = new ResultListener() {
            @Override
            public void onSuiteStart(Suite suite) {
                throw new IllegalStateException("start");
            }

            @Override
            public void onExampleStart(Example example) {
                throw new IllegalStateException("example start");
            }

            @Override
            public void onExampleEnd(ExampleResult result) {
                throw new IllegalStateException("example end");
            }
        };
        Formatter brokenFormatter = new Formatter() {
            @Override
            public void onExampleEnd(ExampleResult result) {
                throw new IllegalStateException("formatter");
            }

            @Override
            public void reportSummary(SuiteResult result) {
                throw new IllegalStateException("summary");
            }
        };
        SuiteResult result = Suite.of(threeExamples())
                .resultListener(broken)
                .formatter(brokenFormatter)
                .run();
        assertEquals(3, result.getExampleCount());
        assertEquals(Suite.of(threeExamples()).run().getFailCount(), result.getFailCount());
        assertFalse(result.isAborted());
    }

}
