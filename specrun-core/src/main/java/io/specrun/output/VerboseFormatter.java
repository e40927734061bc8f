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
package io.specrun.output;

import io.specrun.core.Example;
import io.specrun.core.ExampleGroup;
import io.specrun.core.ExampleResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Prints the group structure as it is entered, and each example coloured by its outcome.
 * <pre>
 * Calc
 *   adds
 *   subs
 * </pre>
 */
public class VerboseFormatter extends ConsoleFormatter {

    private List<ExampleGroup> printed = Collections.emptyList();

    @Override
    public void onExampleStart(Example example) {
        List<ExampleGroup> chain = new ArrayList<>();
        for (ExampleGroup group = example.getParent(); group != null && !group.isRoot(); group = group.getParent()) {
            chain.add(0, group);
        }
        // only print the groups not shared with the previous example
        int common = 0;
        while (common < chain.size() && common < printed.size() && chain.get(common) == printed.get(common)) {
            common++;
        }
        for (int i = common; i < chain.size(); i++) {
            Console.println(indent(i) + chain.get(i).getDescription());
        }
        printed = chain;
    }

    @Override
    public void onExampleEnd(ExampleResult result) {
        Example example = result.getExample();
        Console.println(indent(example.getDepth()) + Console.outcome(example.getDescription(), result.getOutcome()));
    }

    private static String indent(int depth) {
        return "  ".repeat(depth);
    }

}
