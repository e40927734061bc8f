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

import io.specrun.output.Formatter;
import io.specrun.output.JunitXmlWriter;
import io.specrun.output.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * One run of a {@link SpecTree}: walks the tree depth-first in declaration order and runs every
 * example that is selected by the filter, until the run is aborted.
 * <p>
 * A suite runs once. Build a new suite from the same tree to run it again.
 */
public class Suite {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final SpecTree tree;

    // Configuration
    private RunFilter filter = RunFilter.ALL;
    private boolean failFast;
    private Formatter formatter;
    private Path junitXml;
    private final List<ResultListener> resultListeners = new ArrayList<>();

    private final AbortLatch abortLatch = new AbortLatch();

    // Results
    private SuiteResult result;

    private Suite(SpecTree tree) {
        this.tree = tree;
    }

    public static Suite of(SpecTree tree) {
        return new Suite(tree);
    }

    public static Suite of(SpecDefinition... definitions) {
        return new Suite(Spec.tree(definitions));
    }

    // ========== Configuration (Builder Pattern) ==========

    public Suite filter(RunFilter filter) {
        this.filter = filter == null ? RunFilter.ALL : filter;
        return this;
    }

    public Suite failFast(boolean failFast) {
        this.failFast = failFast;
        return this;
    }

    public Suite formatter(Formatter formatter) {
        this.formatter = formatter;
        return this;
    }

    public Suite resultListener(ResultListener listener) {
        this.resultListeners.add(listener);
        return this;
    }

    public Suite junitXml(Path junitXml) {
        this.junitXml = junitXml;
        return this;
    }

    public SpecTree getTree() {
        return tree;
    }

    public RunFilter getFilter() {
        return filter;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public SuiteResult getResult() {
        return result;
    }

    // ========== Abort ==========

    /**
     * Stop the run: no example starts after this call. An example already running is not interrupted.
     * Safe to call from any thread, and before or during {@link #run()}.
     */
    public void abort() {
        if (abortLatch.set()) {
            logger.debug("run aborted");
        }
    }

    public boolean isAborted() {
        return abortLatch.isSet();
    }

    // ========== Execution ==========

    public SuiteResult run() {
        if (result != null) {
            throw new SpecException("suite has already been run");
        }
        result = new SuiteResult();
        result.setStartTime(System.currentTimeMillis());
        logger.debug("running {} declared examples, filter: {}, fail-fast: {}",
                tree.getExampleCount(), filter, failFast);
        try {
            notifyListeners(listeners(), "suite start", listener -> listener.onSuiteStart(this));
            walk(tree.getRoot());
        } finally {
            result.setEndTime(System.currentTimeMillis());
            result.setAborted(abortLatch.isSet());
            notifyListeners(listeners(), "suite end", listener -> listener.onSuiteEnd(result));
            if (formatter != null) {
                try {
                    formatter.reportSummary(result);
                } catch (RuntimeException e) {
                    logger.warn("formatter failed to report summary: {}", e.toString());
                }
            }
            if (junitXml != null) {
                JunitXmlWriter.write(result, junitXml);
            }
        }
        return result;
    }

    private void walk(ExampleGroup group) {
        for (SpecNode node : group.getChildren()) {
            if (node instanceof ExampleGroup) {
                walk((ExampleGroup) node);
            } else {
                runExample((Example) node);
            }
        }
    }

    private void runExample(Example example) {
        if (abortLatch.isSet() || !filter.matches(example)) {
            return;
        }
        List<ResultListener> listeners = listeners();
        notifyListeners(listeners, "example start", listener -> listener.onExampleStart(example));
        ExampleResult er = new ExampleRuntime(example, tree.getHooks()).call();
        result.addResult(er);
        notifyListeners(listeners, "example end", listener -> listener.onExampleEnd(er));
        if (failFast && er.isFailed()) {
            logger.debug("fail-fast: aborting after {}", example);
            abort();
        }
    }

    /**
     * Listeners only observe: a listener that throws is logged and the run goes on.
     */
    private static void notifyListeners(List<ResultListener> listeners, String event, Consumer<ResultListener> call) {
        for (ResultListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("result listener {} failed on {}: {}", listener.getClass().getName(), event, e.toString());
            }
        }
    }

    private List<ResultListener> listeners() {
        if (formatter == null) {
            return resultListeners;
        }
        List<ResultListener> list = new ArrayList<>(resultListeners.size() + 1);
        list.add(formatter);
        list.addAll(resultListeners);
        return list;
    }

}
