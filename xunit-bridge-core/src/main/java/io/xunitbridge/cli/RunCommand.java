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
package io.xunitbridge.cli;

import io.xunitbridge.common.Json;
import io.xunitbridge.core.CancellationSource;
import io.xunitbridge.core.RunCoordinator;
import io.xunitbridge.core.TestContext;
import io.xunitbridge.core.TestFailure;
import io.xunitbridge.core.UnitTestResult;
import io.xunitbridge.protocol.NameFilter;
import io.xunitbridge.protocol.TestCaseDescriptor;
import io.xunitbridge.tree.AssemblySuite;
import io.xunitbridge.tree.TestCaseAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * The 'run' subcommand: discovers an assembly, then runs all or some of its test cases.
 * <p>
 * Usage examples:
 * <pre>
 * # Run everything
 * xunit-bridge run Acme.Tests.dll
 *
 * # Run two test cases by id
 * xunit-bridge run -f Acme.MathTests.Adds -f Acme.MathTests.Subtracts Acme.Tests.dll
 *
 * # Run test cases whose display name matches
 * xunit-bridge run -n ".*Adds.*" Acme.Tests.dll
 * </pre>
 * Ctrl-C cancels the run, the worker is stopped before the JVM exits.
 */
@Command(
        name = "run",
        mixinStandardHelpOptions = true,
        description = "Run the test cases of a test assembly"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

    public static final int EXIT_PASSED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_CANCELED = 130;

    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    @Parameters(
            index = "0",
            description = "Test assembly to run"
    )
    String assemblyPath;

    @Option(
            names = {"-f", "--filter"},
            description = "Id of a test case to run, repeatable"
    )
    List<String> ids;

    @Option(
            names = {"-n", "--name"},
            description = "Display name filter (regex)"
    )
    String namePattern;

    @Option(
            names = {"--json"},
            description = "Print the result as JSON instead of a summary"
    )
    boolean json;

    @Mixin
    BridgeOptions options;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            AssemblySuite suite = options.discover(assemblyPath);
            NameFilter selection = selection(suite);
            if (selection == null) {
                out.println("No test cases match the given filters.");
                out.flush();
                return EXIT_PASSED;
            }
            CancellationSource source = new CancellationSource();
            TestContext context = TestContext.builder(options.config())
                    .executionHandler(options.executionHandler())
                    .token(source.getToken())
                    .build();
            UnitTestResult result = runWithShutdownHook(suite, selection, context, source);
            if (json) {
                out.println(Json.stringifyStrict(result.toMap()));
                out.flush();
            } else {
                printSummary(out, result);
            }
            if (result.isCanceled()) {
                return EXIT_CANCELED;
            }
            return result.isPassed() ? EXIT_PASSED : EXIT_FAILED;
        } catch (Exception e) {
            return Main.printError(spec, e);
        }
    }

    /**
     * @return null if the filters select nothing
     */
    NameFilter selection(AssemblySuite suite) {
        if ((ids == null || ids.isEmpty()) && namePattern == null) {
            return NameFilter.all();
        }
        NameFilter byId = ids == null || ids.isEmpty() ? NameFilter.all() : NameFilter.of(ids);
        Pattern pattern = namePattern == null ? null : Pattern.compile(namePattern);
        List<TestCaseDescriptor> selected = TestCaseAggregator.flatten(suite, tc -> byId.accepts(tc)
                && (pattern == null || pattern.matcher(tc.getDisplayName()).matches()));
        return selected.isEmpty() ? null : NameFilter.ofTestCases(selected);
    }

    private UnitTestResult runWithShutdownHook(AssemblySuite suite, NameFilter selection, TestContext context,
                                               CancellationSource source) {
        CountDownLatch done = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            if (source.cancel()) {
                logger.info("interrupted, canceling test run");
            }
            try {
                done.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "xunit-bridge-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return RunCoordinator.run(suite, suite, selection, context);
        } finally {
            done.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                logger.debug("shutdown in progress, hook stays registered");
            }
        }
    }

    static void printSummary(PrintWriter out, UnitTestResult result) {
        out.println();
        if (result.isCanceled()) {
            out.println(result.getMessage());
            out.flush();
            return;
        }
        for (TestFailure failure : result.getFailures()) {
            out.println("FAILED " + failure.displayName());
            if (failure.message() != null) {
                out.println("  " + failure.message());
            }
            if (failure.stackTrace() != null) {
                failure.stackTrace().lines().forEach(line -> out.println("    " + line));
            }
        }
        if (result.isFaulted()) {
            out.println("Run failed: " + result.getMessage());
            if (result.getCrashLogExcerpt() != null) {
                out.println(result.getCrashLogExcerpt());
            }
        }
        out.println("Total: " + result.getTotalCount()
                + ", passed: " + result.getPassedCount()
                + ", failed: " + result.getFailedCount()
                + ", skipped: " + result.getSkippedCount()
                + " (" + result.getDuration().toMillis() + " ms)");
        out.flush();
    }

}
