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

import io.specrun.output.LogContext;
import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Registration phase of a run. Group blocks are executed immediately to declare their children;
 * example bodies are only stored. {@link #build()} freezes the declarations into a {@link SpecTree}.
 * <p>
 * Every declaration records the file and line of its caller, which is what the line filter matches.
 * <pre>
 * SpecBuilder spec = new SpecBuilder();
 * spec.describe("Calc", () -> {
 *     spec.it("adds", () -> ...);
 * });
 * SpecTree tree = spec.build();
 * </pre>
 */
public class SpecBuilder {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final ExampleGroup root = ExampleGroup.root();
    private final HookSet hooks = new HookSet();
    private final Deque<ExampleGroup> active = new ArrayDeque<>();
    private boolean built;
    private String specClass;

    public SpecBuilder() {
        active.push(root);
    }

    // ========== Groups ==========

    public SpecBuilder describe(String description, Runnable block) {
        return describe(description, SourceLocation.capture(), block);
    }

    public SpecBuilder describe(String description, SourceLocation location, Runnable block) {
        ensureOpen();
        ExampleGroup group = new ExampleGroup(String.valueOf(description), location, current());
        current().add(group);
        active.push(group);
        try {
            block.run();
        } finally {
            active.pop();
        }
        return this;
    }

    /**
     * Same as {@link #describe(String, Runnable)}, reads better for a state or condition.
     */
    public SpecBuilder context(String description, Runnable block) {
        return describe(description, SourceLocation.capture(), block);
    }

    public SpecBuilder context(String description, SourceLocation location, Runnable block) {
        return describe(description, location, block);
    }

    // ========== Examples ==========

    public SpecBuilder it(String description, ExampleBody body) {
        return it(description, SourceLocation.capture(), body);
    }

    public SpecBuilder it(String description, SourceLocation location, ExampleBody body) {
        return add(description, location, body, false);
    }

    /**
     * Declare an example that is reported as pending. The body is never invoked.
     */
    public SpecBuilder pending(String description, ExampleBody body) {
        return pending(description, SourceLocation.capture(), body);
    }

    public SpecBuilder pending(String description, SourceLocation location, ExampleBody body) {
        return add(description, location, body, true);
    }

    /**
     * Shorthand for an example named "assert".
     */
    public SpecBuilder assertThat(ExampleBody body) {
        return it("assert", SourceLocation.capture(), body);
    }

    private SpecBuilder add(String description, SourceLocation location, ExampleBody body, boolean pending) {
        ensureOpen();
        current().add(new Example(String.valueOf(description), location, current(), body, pending, specClass));
        return this;
    }

    // ========== Hooks ==========

    public SpecBuilder beforeEach(Hook hook) {
        ensureOpen();
        hooks.addBeforeEach(hook);
        return this;
    }

    public SpecBuilder afterEach(Hook hook) {
        ensureOpen();
        hooks.addAfterEach(hook);
        return this;
    }

    // ========== Definitions ==========

    /**
     * Run a definition against this builder, at the currently active group.
     */
    public SpecBuilder include(SpecDefinition definition) {
        String outer = specClass;
        specClass = loadableName(definition.getClass());
        try {
            definition.define(this);
        } finally {
            specClass = outer;
        }
        return this;
    }

    private static String loadableName(Class<?> type) {
        if (type.isHidden() || type.isAnonymousClass() || type.isSynthetic()) {
            return null;
        }
        return type.getName();
    }

    public SpecTree build() {
        ensureOpen();
        if (active.size() != 1) {
            throw new SpecException("build() called inside a group block");
        }
        built = true;
        root.freeze();
        SpecTree tree = new SpecTree(root, hooks.freeze());
        logger.debug("spec tree built: {} examples, {} before-each, {} after-each hooks",
                tree.getExampleCount(), hooks.getBeforeEach().size(), hooks.getAfterEach().size());
        return tree;
    }

    private ExampleGroup current() {
        return active.peek();
    }

    private void ensureOpen() {
        if (built) {
            throw new SpecException("spec tree already built, declarations are closed");
        }
    }

}
