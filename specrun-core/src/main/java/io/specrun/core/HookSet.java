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
 * Before-each and after-each hooks in registration order.
 * Hooks are global: they run around every executed example of the tree, wherever they were declared.
 */
public class HookSet {

    private final List<Hook> beforeEach;
    private final List<Hook> afterEach;

    public HookSet() {
        this(new ArrayList<>(), new ArrayList<>());
    }

    private HookSet(List<Hook> beforeEach, List<Hook> afterEach) {
        this.beforeEach = beforeEach;
        this.afterEach = afterEach;
    }

    void addBeforeEach(Hook hook) {
        beforeEach.add(hook);
    }

    void addAfterEach(Hook hook) {
        afterEach.add(hook);
    }

    HookSet freeze() {
        return new HookSet(Collections.unmodifiableList(new ArrayList<>(beforeEach)),
                Collections.unmodifiableList(new ArrayList<>(afterEach)));
    }

    public List<Hook> getBeforeEach() {
        return beforeEach;
    }

    public List<Hook> getAfterEach() {
        return afterEach;
    }

    /**
     * Run before-each hooks in order, stopping at the first one that throws.
     */
    public void runBeforeEach() throws Exception {
        for (Hook hook : beforeEach) {
            hook.run();
        }
    }

    /**
     * Run every after-each hook in order, even if earlier ones throw.
     *
     * @return the throwables raised, in order (empty if all hooks completed)
     */
    public List<Throwable> runAfterEach() {
        List<Throwable> errors = new ArrayList<>();
        for (Hook hook : afterEach) {
            try {
                hook.run();
            } catch (Throwable t) {
                errors.add(t);
            }
        }
        return errors;
    }

}
