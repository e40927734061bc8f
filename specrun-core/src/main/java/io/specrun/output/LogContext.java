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

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Thread-local log collector for the example currently running.
 * Text logged by example code lands in the example result (and the JUnit XML system-out)
 * and is forwarded to the {@code specrun.example} SLF4J category.
 */
public class LogContext {

    private static final ThreadLocal<LogContext> CURRENT = new ThreadLocal<>();

    // ========== Category Loggers ==========

    /** Suite, walker and example lifecycle */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("specrun.runtime");

    /** Messages logged by example bodies and hooks */
    public static final Logger EXAMPLE_LOGGER = LoggerFactory.getLogger("specrun.example");

    /** Copy of console output, ANSI codes stripped */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("specrun.console");

    private static LogLevel threshold = LogLevel.INFO;

    private final StringBuilder buffer = new StringBuilder();

    // ========== Thread-Local Access ==========

    public static LogContext get() {
        LogContext ctx = CURRENT.get();
        if (ctx == null) {
            ctx = new LogContext();
            CURRENT.set(ctx);
        }
        return ctx;
    }

    public static void set(LogContext ctx) {
        CURRENT.set(ctx);
    }

    public static void clear() {
        CURRENT.remove();
    }

    /**
     * Minimum level captured into example results.
     */
    public static void setLogLevel(LogLevel level) {
        threshold = level;
    }

    public static LogLevel getLogLevel() {
        return threshold;
    }

    /**
     * Set the level of the "specrun" Logback logger, which all categories inherit.
     *
     * @param level trace, debug, info, warn or error
     * @return false if the level is empty or SLF4J is not bound to Logback
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        Logger logger = LoggerFactory.getLogger("specrun");
        if (!(logger instanceof ch.qos.logback.classic.Logger)) {
            RUNTIME_LOGGER.debug("runtime log level not supported: not using logback");
            return false;
        }
        ((ch.qos.logback.classic.Logger) logger).setLevel(Level.toLevel(level.toUpperCase(), Level.INFO));
        RUNTIME_LOGGER.debug("set runtime log level to: {}", level);
        return true;
    }

    // ========== Logging ==========

    public void log(LogLevel level, String format, Object... args) {
        if (!level.isEnabled(threshold)) {
            return;
        }
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        buffer.append(message).append('\n');
        switch (level) {
            case TRACE -> EXAMPLE_LOGGER.trace(message);
            case DEBUG -> EXAMPLE_LOGGER.debug(message);
            case INFO -> EXAMPLE_LOGGER.info(message);
            case WARN -> EXAMPLE_LOGGER.warn(message);
            case ERROR -> EXAMPLE_LOGGER.error(message);
        }
    }

    /**
     * Log at INFO level, with SLF4J-style {} placeholders.
     */
    public void log(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    // ========== Collect ==========

    /**
     * Get accumulated log and clear the buffer.
     */
    public String collect() {
        String result = buffer.toString();
        buffer.setLength(0);
        return result;
    }

    public String peek() {
        return buffer.toString();
    }

}
