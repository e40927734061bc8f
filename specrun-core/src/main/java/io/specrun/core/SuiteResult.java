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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one run, in the order examples were executed.
 */
public class SuiteResult {

    private final List<ExampleResult> results = new ArrayList<>();
    private final Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
    private long startTime;
    private long endTime;
    private boolean aborted;

    public SuiteResult() {
        for (Outcome outcome : Outcome.values()) {
            counts.put(outcome, 0);
        }
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    void setAborted(boolean aborted) {
        this.aborted = aborted;
    }

    /**
     * True if the run was cut short by an interrupt or by fail-fast.
     */
    public boolean isAborted() {
        return aborted;
    }

    public void addResult(ExampleResult result) {
        results.add(result);
        counts.merge(result.getOutcome(), 1, Integer::sum);
    }

    public List<ExampleResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    // ========== Aggregation ==========

    public int getCount(Outcome outcome) {
        return counts.get(outcome);
    }

    public int getExampleCount() {
        return results.size();
    }

    public int getSuccessCount() {
        return getCount(Outcome.SUCCESS);
    }

    public int getFailCount() {
        return getCount(Outcome.FAIL);
    }

    public int getErrorCount() {
        return getCount(Outcome.ERROR);
    }

    public int getPendingCount() {
        return getCount(Outcome.PENDING);
    }

    /**
     * Fail and error results, in the order they happened.
     */
    public List<ExampleResult> getFailures() {
        List<ExampleResult> list = new ArrayList<>();
        for (ExampleResult result : results) {
            if (result.isFailed()) {
                list.add(result);
            }
        }
        return list;
    }

    public List<ExampleResult> getPending() {
        List<ExampleResult> list = new ArrayList<>();
        for (ExampleResult result : results) {
            if (result.isPending()) {
                list.add(result);
            }
        }
        return list;
    }

    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        for (ExampleResult result : getFailures()) {
            errors.add(result.getExample().getPath() + ": " + result.getMessage());
        }
        return errors;
    }

    public boolean isPassed() {
        return getFailCount() == 0 && getErrorCount() == 0;
    }

    public boolean isFailed() {
        return !isPassed();
    }

    public int getExitCode() {
        return isPassed() ? 0 : 1;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

}
