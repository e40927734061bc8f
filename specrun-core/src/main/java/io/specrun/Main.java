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
package io.specrun;

import io.specrun.core.InterruptHandler;
import io.specrun.core.Runner;
import io.specrun.core.SpecException;
import io.specrun.core.Suite;
import io.specrun.core.SuiteResult;
import io.specrun.output.Console;
import io.specrun.output.LogContext;
import org.slf4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for running specs.
 * <p>
 * Usage examples:
 * <pre>
 * # Run every spec registered in META-INF/services
 * java -jar specrun.jar
 *
 * # Run one spec class, only examples whose name contains "adds"
 * java -jar specrun.jar -e adds com.example.CalcSpec
 *
 * # Run the example declared on line 14, stop on first failure
 * java -jar specrun.jar -l 14 --fail-fast com.example.CalcSpec
 * </pre>
 */
@Command(
        name = "specrun",
        mixinStandardHelpOptions = true,
        version = "specrun 1.0",
        description = "Run describe/it specs"
)
public class Main implements Callable<Integer> {

    static final int EXIT_USAGE = 2;

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    @Parameters(
            description = "Spec classes (implementing io.specrun.core.SpecDefinition) to run, default: all registered",
            arity = "0..*"
    )
    List<String> specs;

    @Option(
            names = {"-e", "--example"},
            paramLabel = "STRING",
            description = "Run examples whose full nested names include STRING"
    )
    String example;

    @Option(
            names = {"-l", "--line"},
            paramLabel = "LINE",
            description = "Run examples whose line matches LINE"
    )
    Integer line;

    @Option(
            names = {"--fail-fast"},
            description = "Abort the run on first failure"
    )
    boolean failFast;

    @Option(
            names = {"-v", "--verbose"},
            description = "Verbose output"
    )
    boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    @Option(
            names = {"--junit-xml"},
            paramLabel = "FILE",
            description = "Also write a JUnit XML report to FILE"
    )
    String junitXml;

    @Option(
            names = {"--log-level"},
            paramLabel = "LEVEL",
            description = "Log level for the specrun loggers (trace, debug, info, warn, error)"
    )
    String logLevel;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Parse and run, returning the exit code instead of exiting.
     */
    public static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        if (logLevel != null) {
            LogContext.setRuntimeLogLevel(logLevel);
        }
        Runner.Builder builder = Runner.builder()
                .specClasses(specs)
                .example(example)
                .line(line)
                .failFast(failFast)
                .verbose(verbose);
        if (junitXml != null) {
            builder.junitXml(Path.of(junitXml));
        }
        Suite suite;
        try {
            suite = builder.suite();
        } catch (SpecException e) {
            Console.println(Console.fail("Error: " + e.getMessage()));
            logger.debug("failed to set up run", e);
            return EXIT_USAGE;
        }
        SuiteResult result;
        try (InterruptHandler handler = InterruptHandler.install(suite)) {
            result = suite.run();
        }
        return result.getExitCode();
    }

    // ========== Getters for programmatic access ==========

    public List<String> getSpecs() {
        return specs;
    }

    public String getExample() {
        return example;
    }

    public Integer getLine() {
        return line;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Parse command-line arguments without executing.
     */
    public static Main parse(String... args) {
        Main main = new Main();
        new CommandLine(main).parseArgs(args);
        return main;
    }

}
