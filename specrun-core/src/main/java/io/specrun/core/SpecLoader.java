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

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Loads {@link SpecDefinition} implementations by class name, or discovers them via
 * {@code META-INF/services/io.specrun.core.SpecDefinition}.
 */
public final class SpecLoader {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private SpecLoader() {
    }

    public static SpecDefinition load(String className) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new SpecException("spec class not found: " + className, e);
        }
        if (!SpecDefinition.class.isAssignableFrom(type)) {
            throw new SpecException(className + " does not implement " + SpecDefinition.class.getName());
        }
        try {
            return (SpecDefinition) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new SpecException("cannot instantiate spec class: " + className, e);
        }
    }

    public static List<SpecDefinition> load(List<String> classNames) {
        List<SpecDefinition> list = new ArrayList<>();
        for (String className : classNames) {
            list.add(load(className));
        }
        return list;
    }

    public static List<SpecDefinition> discover() {
        List<SpecDefinition> list = new ArrayList<>();
        for (SpecDefinition definition : ServiceLoader.load(SpecDefinition.class)) {
            list.add(definition);
        }
        logger.debug("discovered {} spec definitions", list.size());
        return list;
    }

}
