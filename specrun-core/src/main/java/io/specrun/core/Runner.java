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

import io.specrun.output.DotFormatter;
import io.specrun.output.Formatter;
import io.specrun.output.VerboseFormatter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Main entry point for running specs programmatically.
 * <p>
 * Example usage:
 * <pre>
 * SuiteResult result = Runner.specs(new CalcSpec())
 *     .example("Calc adds")
 *     .failFast(true)
 *     .run();
 * System.exit(result.getExitCode());
 * </pre>
 */
public final class Runner {

    private Runner() {
    }

    public static Builder specs(SpecDefinition... definitions) {
        return new Builder().specs(definitions);
    }

    /**
     * Start with spec classes given by name, loaded with {@link SpecLoader}.
     */
    public static Builder specClasses(String... classNames) {
        return new Builder().specClasses(Arrays.asList(classNames));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Builder ==========

    public static class Builder {

        private final List<SpecDefinition> definitions = new ArrayList<>();
        private final List<String> classNames = new ArrayList<>();
        private final List<ResultListener> resultListeners = new ArrayList<>();

        private String example;
        private Integer line;
        private boolean failFast;
        private boolean verbose;
        private Formatter formatter;
        private Path junitXml;

        Builder() {
        }

        public Builder specs(SpecDefinition... values) {
            definitions.addAll(Arrays.asList(values));
            return this;
        }

        public Builder specClasses(List<String> values) {
            if (values != null) {
                classNames.addAll(values);
            }
            return this;
        }

        /**
         * Run only examples whose full nested name contains this text.
         */
        public Builder example(String pattern) {
            this.example = pattern;
            return this;
        }

        /**
         * Run only examples (or groups) declared on this line. Takes precedence over {@link #example}.
         */
        public Builder line(Integer line) {
            this.line = line;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        /**
         * Use the {@link VerboseFormatter} instead of the default {@link DotFormatter}.
         */
        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder formatter(Formatter formatter) {
            this.formatter = formatter;
            return this;
        }

        public Builder resultListener(ResultListener listener) {
            resultListeners.add(listener);
            return this;
        }

        public Builder junitXml(Path file) {
            this.junitXml = file;
            return this;
        }

        /**
         * Declare the tree and configure a suite without running it.
         * With no definitions and no class names, definitions are discovered via ServiceLoader.
         */
        public Suite suite() {
            List<SpecDefinition> all = new ArrayList<>(definitions);
            all.addAll(SpecLoader.load(classNames));
            if (all.isEmpty()) {
                all.addAll(SpecLoader.discover());
            }
            Suite suite = Suite.of(Spec.tree(all))
                    .filter(RunFilter.of(example, line))
                    .failFast(failFast)
                    .formatter(resolveFormatter())
                    .junitXml(junitXml);
            for (ResultListener listener : resultListeners) {
                suite.resultListener(listener);
            }
            return suite;
        }

        public SuiteResult run() {
            return suite().run();
        }

        private Formatter resolveFormatter() {
            if (formatter != null) {
                return formatter;
            }
            return verbose ? new VerboseFormatter() : new DotFormatter();
        }

    }

}
