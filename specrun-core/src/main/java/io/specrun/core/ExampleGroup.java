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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named group of examples and nested groups, declared with {@code describe} or {@code context}.
 * Children are kept in declaration order. The structure is frozen when the tree is built.
 */
public class ExampleGroup implements SpecNode {

    private final String description;
    private final SourceLocation location;
    private final ExampleGroup parent;
    private List<SpecNode> children = new ArrayList<>();

    ExampleGroup(String description, SourceLocation location, ExampleGroup parent) {
        this.description = description;
        this.location = location;
        this.parent = parent;
    }

    static ExampleGroup root() {
        return new ExampleGroup("", SourceLocation.UNKNOWN, null);
    }

    void add(SpecNode node) {
        children.add(node);
    }

    void freeze() {
        for (SpecNode child : children) {
            if (child instanceof ExampleGroup) {
                ((ExampleGroup) child).freeze();
            }
        }
        children = Collections.unmodifiableList(children);
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

    public boolean isRoot() {
        return parent == null;
    }

    public List<SpecNode> getChildren() {
        return children;
    }

    public List<ExampleGroup> getGroups() {
        List<ExampleGroup> list = new ArrayList<>();
        for (SpecNode child : children) {
            if (child instanceof ExampleGroup) {
                list.add((ExampleGroup) child);
            }
        }
        return list;
    }

    public List<Example> getExamples() {
        List<Example> list = new ArrayList<>();
        for (SpecNode child : children) {
            if (child instanceof Example) {
                list.add((Example) child);
            }
        }
        return list;
    }

    /**
     * Descriptions from the outermost group down to this one, root excluded, joined by a space.
     */
    public String getPath() {
        if (isRoot()) {
            return "";
        }
        String parentPath = parent.getPath();
        return parentPath.isEmpty() ? description : parentPath + " " + description;
    }

    /**
     * All examples below this group, depth-first in declaration order.
     */
    public List<Example> getAllExamples() {
        List<Example> list = new ArrayList<>();
        collect(this, list);
        return list;
    }

    private static void collect(ExampleGroup group, List<Example> list) {
        for (SpecNode child : group.children) {
            if (child instanceof Example) {
                list.add((Example) child);
            } else {
                collect((ExampleGroup) child, list);
            }
        }
    }

    @Override
    public String toString() {
        return isRoot() ? "<root>" : getPath();
    }

}
