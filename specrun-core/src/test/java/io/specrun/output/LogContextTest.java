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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void cleanup() {
        LogContext.setLogLevel(LogLevel.INFO);
        LogContext.setRuntimeLogLevel("warn");
        LogContext.clear();
    }

    @Test
    void testThresholdFiltersCapturedLog() {
        LogContext ctx = LogContext.get();
        ctx.log(LogLevel.DEBUG, "hidden");
        ctx.log(LogLevel.WARN, "shown {}", 1);
        assertEquals("shown 1\n", ctx.collect());
        assertEquals("", ctx.peek());

        LogContext.setLogLevel(LogLevel.TRACE);
        ctx.log(LogLevel.DEBUG, "now visible");
        assertEquals("now visible\n", ctx.collect());
    }

    @Test
    void testContextIsPerThread() throws Exception {
        LogContext.get().log("main thread");
        Thread other = new Thread(() -> LogContext.get().log("other thread"));
        other.start();
        other.join();
        assertEquals("main thread\n", LogContext.get().peek());
    }

    @Test
    void testSetRuntimeLogLevel() {
        assertFalse(LogContext.setRuntimeLogLevel(null));
        assertFalse(LogContext.setRuntimeLogLevel(""));
        assertTrue(LogContext.setRuntimeLogLevel("debug"));
        assertTrue(LoggerFactory.getLogger("specrun.runtime").isDebugEnabled());
        assertTrue(LogContext.setRuntimeLogLevel("error"));
        assertFalse(LoggerFactory.getLogger("specrun.runtime").isWarnEnabled());
    }

}
