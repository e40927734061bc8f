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

import java.util.Collections;
import java.util.List;

public class ExampleResult {

    private final Example example;
    private final Outcome outcome;
    private final Throwable error;
    private final List<Throwable> afterHookErrors;
    private long startTime;
    private long durationNanos;
    private String log;

    private ExampleResult(Example example, Outcome outcome, Throwable error, List<Throwable> afterHookErrors) {
        this.example = example;
        this.outcome = outcome;
        this.error = error;
        this.afterHookErrors = afterHookErrors == null ? Collections.emptyList() : afterHookErrors;
    }

    public static ExampleResult success(Example example) {
        return new ExampleResult(example, Outcome.SUCCESS, null, null);
    }

    public static ExampleResult pending(Example example) {
        return new ExampleResult(example, Outcome.PENDING, null, null);
    }

    /**
     * Classify a throwable raised by a hook or body.
     */
    public static ExampleResult failed(Example example, Throwable error, List<Throwable> afterHookErrors) {
        Outcome outcome = error instanceof AssertionFailure ? Outcome.FAIL : Outcome.ERROR;
        return new ExampleResult(example, outcome, error, afterHookErrors);
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setDurationNanos(long durationNanos) {
        this.durationNanos = durationNanos;
    }

    void setLog(String log) {
        this.log = log;
    }

    public Example getExample() {
        return example;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Throwable getError() {
        return error;
    }

    /**
     * Throwables raised by after-each hooks, also attached to {@link #getError()} as suppressed
     * when the hook was not the first failure.
     */
    public List<Throwable> getAfterHookErrors() {
        return afterHookErrors;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getDurationNanos() {
        return durationNanos;
    }

    public double getDurationMillis() {
        return durationNanos / 1_000_000.0;
    }

    public String getLog() {
        return log;
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isFailed() {
        return outcome.isFailure();
    }

    public boolean isPending() {
        return outcome == Outcome.PENDING;
    }

    public String getMessage() {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return message == null ? error.getClass().getName() : message;
    }

    /**
     * Where to look for the problem: the location carried by an assertion failure,
     * otherwise the declaration of the example.
     */
    public SourceLocation getFailureLocation() {
        if (error instanceof AssertionFailure) {
            return ((AssertionFailure) error).getLocation();
        }
        return example.getLocation();
    }

    @Override
    public String toString() {
        return outcome + " " + example;
    }

}
