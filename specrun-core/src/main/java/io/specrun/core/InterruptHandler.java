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
import io.specrun.output.LogContext;
import org.slf4j.Logger;
import sun.misc.Signal;
import sun.misc.SignalHandler;

/**
 * Turns an interrupt (Ctrl+C, SIGINT) into {@link Suite#abort()} without shutting the JVM down.
 * <p>
 * The example in flight finishes, the remaining ones are skipped, the summary is printed and the
 * run exits with its own exit code. A second interrupt falls through to the previous handler,
 * which normally terminates the JVM.
 * <pre>
 * try (InterruptHandler handler = InterruptHandler.install(suite)) {
 *     result = suite.run();
 * }
 * </pre>
 */
public final class InterruptHandler implements AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final Signal SIGINT = new Signal("INT");

    private final Suite suite;
    private SignalHandler previous;

    private InterruptHandler(Suite suite) {
        this.suite = suite;
    }

    public static InterruptHandler install(Suite suite) {
        InterruptHandler handler = new InterruptHandler(suite);
        try {
            handler.previous = Signal.handle(SIGINT, signal -> handler.onInterrupt());
        } catch (IllegalArgumentException e) {
            // SIGINT is reserved, e.g. when the JVM runs with -Xrs
            logger.debug("cannot trap SIGINT, interrupt will terminate the run: {}", e.getMessage());
        }
        return handler;
    }

    /**
     * What happens on the first interrupt: the suite is aborted and the previous handler is put back.
     */
    void onInterrupt() {
        restore();
        suite.abort();
        Console.println();
        Console.println(Console.warn("Interrupted: waiting for the current example to finish..."));
    }

    synchronized boolean isInstalled() {
        return previous != null;
    }

    private synchronized void restore() {
        if (previous == null) {
            return;
        }
        try {
            Signal.handle(SIGINT, previous);
        } catch (IllegalArgumentException e) {
            logger.warn("failed to restore SIGINT handler: {}", e.getMessage());
        }
        previous = null;
    }

    @Override
    public void close() {
        restore();
    }

}
