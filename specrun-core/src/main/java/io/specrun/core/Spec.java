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

import java.util.Arrays;
import java.util.List;

/**
 * Static entry points for spec authors: building trees and raising failures.
 */
public final class Spec {

    private Spec() {
    }

    /**
     * Raise an {@link AssertionFailure} located at the calling line.
     */
    public static void fail(String message) {
        throw new AssertionFailure(message, SourceLocation.capture());
    }

    public static void fail(String message, String file, int line) {
        throw new AssertionFailure(message, file, line);
    }

    /**
     * Fail with the given message unless the condition holds.
     */
    public static void check(boolean condition, String message) {
        if (!condition) {
            throw new AssertionFailure(message, SourceLocation.capture());
        }
    }

    public static SpecTree tree(SpecDefinition... definitions) {
        return tree(Arrays.asList(definitions));
    }

    public static SpecTree tree(List<SpecDefinition> definitions) {
        SpecBuilder builder = new SpecBuilder();
        for (SpecDefinition definition : definitions) {
            builder.include(definition);
        }
        return builder.build();
    }

}
