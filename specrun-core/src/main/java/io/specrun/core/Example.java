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
 * A single declared test case. The body runs only if the example is selected,
 * and never for a pending example.
 */
public class Example implements SpecNode {

    private final String description;
    private final SourceLocation location;
    private final ExampleGroup parent;
    private final ExampleBody body;
    private final boolean pending;
    private final String specClass;

    Example(String description, SourceLocation location, ExampleGroup parent, ExampleBody body, boolean pending,
            String specClass) {
        this.description = description;
        this.location = location;
        this.parent = parent;
        this.body = body;
        this.pending = pending;
        this.specClass = specClass;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public ExampleGroup getParent() {
        return parent;
    }

    public ExampleBody getBody() {
        return body;
    }

    public boolean isPending() {
        return pending;
    }

    /**
     * Class name of the {@link SpecDefinition} that declared this example, or null if it was declared
     * directly on a builder or by a definition that cannot be loaded by name (lambda, anonymous class).
     */
    public String getSpecClass() {
        return specClass;
    }

    /**
     * Full nested name: every enclosing group description followed by this description.
     * This is the string the name filter is matched against.
     */
    public String getPath() {
        String groupPath = parent == null ? "" : parent.getPath();
        return groupPath.isEmpty() ? description : groupPath + " " + description;
    }

    /**
     * True if this example, or one of its enclosing groups, is declared on the given line.
     */
    public boolean isDeclaredOnLine(int line) {
        if (location.line() == line) {
            return true;
        }
        for (ExampleGroup group = parent; group != null && !group.isRoot(); group = group.getParent()) {
            if (group.getLocation().line() == line) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return getPath() + " (" + location + ")";
    }

}
