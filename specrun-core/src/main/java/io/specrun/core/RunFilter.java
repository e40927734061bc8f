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
 * Decides which declared examples run.
 * <ul>
 *   <li>an example declared on the filter line, or nested in a group declared on it, always runs</li>
 *   <li>otherwise, with a pattern or a line set, it runs only if its full path contains the pattern
 *   (literal substring, no regex)</li>
 *   <li>with neither set, everything runs</li>
 * </ul>
 */
public final class RunFilter {

    public static final RunFilter ALL = new RunFilter(null, null);

    private final String pattern;
    private final Integer line;

    private RunFilter(String pattern, Integer line) {
        this.pattern = pattern;
        this.line = line;
    }

    public static RunFilter of(String pattern, Integer line) {
        if (pattern == null && line == null) {
            return ALL;
        }
        return new RunFilter(pattern, line);
    }

    public static RunFilter pattern(String pattern) {
        return of(pattern, null);
    }

    public static RunFilter line(int line) {
        return of(null, line);
    }

    public String getPattern() {
        return pattern;
    }

    public Integer getLine() {
        return line;
    }

    public boolean isEmpty() {
        return pattern == null && line == null;
    }

    /**
     * Match a candidate by its full path and its own declared location.
     */
    public boolean matches(String path, SourceLocation location) {
        if (line != null && location != null && location.line() == line) {
            return true;
        }
        return matchesPattern(path);
    }

    /**
     * Match a declared example, where the line filter also selects every example
     * inside a group declared on that line.
     */
    public boolean matches(Example example) {
        if (line != null && example.isDeclaredOnLine(line)) {
            return true;
        }
        return matchesPattern(example.getPath());
    }

    private boolean matchesPattern(String path) {
        if (pattern == null && line == null) {
            return true;
        }
        return pattern != null && path != null && path.contains(pattern);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "all";
        }
        StringBuilder sb = new StringBuilder();
        if (pattern != null) {
            sb.append("example: '").append(pattern).append("'");
        }
        if (line != null) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append("line: ").append(line);
        }
        return sb.toString();
    }

}
