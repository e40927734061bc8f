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

import io.specrun.output.LogContext;
import org.slf4j.Logger;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs one selected example: before-each hooks, body, after-each hooks, then classifies the outcome.
 * Nothing thrown by example code escapes {@link #call()}.
 */
public class ExampleRuntime implements Callable<ExampleResult> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Example example;
    private final HookSet hooks;

    public ExampleRuntime(Example example, HookSet hooks) {
        this.example = example;
        this.hooks = hooks;
    }

    public Example getExample() {
        return example;
    }

    @Override
    public ExampleResult call() {
        LogContext.set(new LogContext());
        long startTime = System.currentTimeMillis();
        long startNanos = System.nanoTime();
        ExampleResult result;
        try {
            result = example.isPending() ? ExampleResult.pending(example) : execute();
            result.setLog(trimLog(LogContext.get().collect()));
        } finally {
            LogContext.clear();
        }
        result.setStartTime(startTime);
        result.setDurationNanos(System.nanoTime() - startNanos);
        return result;
    }

    private ExampleResult execute() {
        Throwable error = null;
        try {
            hooks.runBeforeEach();
            example.getBody().run();
        } catch (Throwable t) {
            error = t;
        }
        List<Throwable> afterErrors = hooks.runAfterEach();
        for (Throwable t : afterErrors) {
            if (error == null) {
                error = t;
            } else if (t != error) {
                error.addSuppressed(t);
            }
        }
        if (error == null) {
            return ExampleResult.success(example);
        }
        logger.debug("example failed: {} - {}", example, error.toString());
        return ExampleResult.failed(example, error, afterErrors);
    }

    private static String trimLog(String log) {
        return log.endsWith("\n") ? log.substring(0, log.length() - 1) : log;
    }

}
