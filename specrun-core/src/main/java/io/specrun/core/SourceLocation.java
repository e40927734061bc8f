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

import java.util.Set;

/**
 * File name and line of a declaration, captured from the declaring call site.
 */
public record SourceLocation(String file, int line) {

    public static final SourceLocation UNKNOWN = new SourceLocation("unknown", 0);

    // frames of these classes belong to the declaration api, never to the spec author
    private static final Set<String> API_CLASSES = Set.of(
            SourceLocation.class.getName(),
            SpecBuilder.class.getName(),
            Spec.class.getName()
    );

    public static SourceLocation of(String file, int line) {
        return new SourceLocation(file, line);
    }

    /**
     * Walk the current stack and return the location of the first frame outside the declaration api.
     */
    public static SourceLocation capture() {
        return StackWalker.getInstance().walk(frames -> frames
                .filter(frame -> !API_CLASSES.contains(frame.getClassName()))
                .findFirst()
                .map(frame -> {
                    String file = frame.getFileName();
                    return new SourceLocation(file == null ? frame.getClassName() : file, frame.getLineNumber());
                })
                .orElse(UNKNOWN));
    }

    @Override
    public String toString() {
        return file + ":" + line;
    }

}
