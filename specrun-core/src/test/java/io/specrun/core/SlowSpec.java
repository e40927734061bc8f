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

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fixture for interrupt handling: the first example touches the file named by the
 * {@code specrun.marker} system property, then keeps running for a while.
 */
public class SlowSpec implements SpecDefinition {

    static final String MARKER_PROPERTY = "specrun.marker";

    @Override
    public void define(SpecBuilder spec) {
        spec.describe("Slow", () -> {
            spec.it("takes its time", () -> {
                String marker = System.getProperty(MARKER_PROPERTY);
                if (marker != null) {
                    Files.createFile(Path.of(marker));
                }
                Thread.sleep(1500);
            });
            spec.it("runs after", () -> {
            });
        });
    }

}
