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

/**
 * Raised deliberately by example code when an expected condition does not hold.
 * Classified as {@link Outcome#FAIL}; every other throwable is an {@link Outcome#ERROR}.
 */
public class AssertionFailure extends RuntimeException {

    private final String file;
    private final int line;

    public AssertionFailure(String message, String file, int line) {
        super(message);
        this.file = file;
        this.line = line;
    }

    public AssertionFailure(String message, SourceLocation location) {
        this(message, location.file(), location.line());
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public SourceLocation getLocation() {
        return SourceLocation.of(file, line);
    }

}
