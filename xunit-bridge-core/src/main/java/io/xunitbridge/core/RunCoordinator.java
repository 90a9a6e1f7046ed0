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
package io.xunitbridge.core;

import io.xunitbridge.client.ConnectionException;
import io.xunitbridge.client.RunnerClient;
import io.xunitbridge.client.WorkerCrashedException;
import io.xunitbridge.common.Messages;
import io.xunitbridge.protocol.NameFilter;
import io.xunitbridge.protocol.TestCaseDescriptor;
import io.xunitbridge.tree.AssemblySuite;
import io.xunitbridge.tree.TestCaseAggregator;
import io.xunitbridge.tree.TestCaseNode;
import io.xunitbridge.tree.TestGroup;
import io.xunitbridge.tree.TestNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs part of a test tree in a fresh worker and turns whatever happened into
 * one {@link UnitTestResult}.
 * <p>
 * A run that raised is reconciled as canceled when the host canceled it, no matter
 * what the underlying failure was, and as failed otherwise. The client, the
 * cancellation registration and the crash log are released on every path, in
 * that order, before the session is closed.
 */
public final class RunCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(RunCoordinator.class);

    static final int CRASH_LOG_EXCERPT_CHARS = 4000;

    private RunCoordinator() {
    }

    /**
     * Run a single test case. Its status changes are not reported to the context's
     * result listener.
     */
    public static UnitTestResult runTestCase(AssemblySuite root, TestCaseNode testCase, TestContext context) {
        return run(root, testCase, NameFilter.all(), context, false);
    }

    public static UnitTestResult runTestSuite(AssemblySuite root, TestGroup suite, TestContext context) {
        return run(root, suite, NameFilter.all(), context);
    }

    public static UnitTestResult runAssemblySuite(AssemblySuite root, TestContext context) {
        return run(root, root, NameFilter.all(), context);
    }

    /**
     * Run the test cases under {@code target} that {@code selection} accepts.
     * If there are none, no worker is started and an empty result is returned.
     */
    public static UnitTestResult run(AssemblySuite root, TestNode target, NameFilter selection, TestContext context) {
        return run(root, target, selection, context, context.isReportToMonitor());
    }

    private static UnitTestResult run(AssemblySuite root, TestNode target, NameFilter selection, TestContext context,
                                      boolean reportToMonitor) {
        List<TestCaseDescriptor> testCases = TestCaseAggregator.flatten(target, selection::accepts);
        if (testCases.isEmpty()) {
            logger.info("no test cases to run under {}", target.getPath());
            return UnitTestResult.empty();
        }
        try (ExecutionSession session = ExecutionSession.create(target, context, reportToMonitor)) {
            execute(root, target, testCases, session, context);
            return session.getResult();
        }
    }

    private static void execute(AssemblySuite root, TestNode target, List<TestCaseDescriptor> testCases,
                                ExecutionSession session, TestContext context) {
        BridgeConfig config = context.getConfig();
        LocalTestMonitor monitor = new LocalTestMonitor(session, testCases);
        RunnerClient client = context.getClientFactory().create(context, session.getConsole()::println);
        CancellationRegistration registration = null;
        Path crashLog = null;
        try {
            crashLog = createCrashLog(config.resolveCrashLogDir());
            registration = context.getToken().register(new RunCancellation(monitor, client, target));
            context.getToken().throwIfCancellationRequested();
            client.connect(config.getRuntimeVersion(), context.getExecutionHandler()).join();
            List<String> ids = new ArrayList<>(testCases.size());
            testCases.forEach(tc -> ids.add(tc.getId()));
            logger.debug("running {} test case(s) from {}", ids.size(), root.getAssemblyPath());
            client.run(monitor, ids, root.getAssemblyPath(), configPathOf(root, config), supportAssembliesOf(root, config),
                    null, null, crashLog).join();
            session.complete(monitor.buildResult());
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (monitor.isCanceled()) {
                logger.debug("run of {} canceled: {}", target.getPath(), cause.getMessage());
                // a result event may have marked a node running after the cancellation reset
                monitor.resetRunning(target);
                session.cancel(UnitTestResult.createCanceled(Messages.get("run.canceled")));
            } else {
                logger.error("test run of {} failed", target.getPath(), cause);
                UnitTestResult result = createFailure(cause);
                monitor.resetRunning(target);
                session.fail(result);
            }
        } finally {
            client.close();
            if (registration != null) {
                registration.close();
            }
            deleteCrashLog(crashLog);
        }
    }

    private static UnitTestResult createFailure(Throwable cause) {
        if (cause instanceof WorkerCrashedException crash) {
            Path path = crash.getCrashLogPath();
            String message = Messages.get("run.workerCrashed", String.valueOf(crash.getExitCode()), String.valueOf(path));
            UnitTestResult result = UnitTestResult.createFailure(message, crash);
            result.setCrashLogExcerpt(readExcerpt(path));
            return result;
        }
        if (cause instanceof ConnectionException) {
            return UnitTestResult.createFailure(Messages.get("run.connectionFailed", cause.getMessage()), cause);
        }
        return UnitTestResult.createFailure(cause);
    }

    private static String configPathOf(AssemblySuite root, BridgeConfig config) {
        return root.getConfigPath() != null ? root.getConfigPath() : config.getConfigPath();
    }

    private static List<String> supportAssembliesOf(AssemblySuite root, BridgeConfig config) {
        return root.getSupportAssemblies().isEmpty() ? config.getSupportAssemblies() : root.getSupportAssemblies();
    }

    static Path createCrashLog(Path dir) throws IOException {
        Files.createDirectories(dir);
        return Files.createTempFile(dir, "xunit-crash-", ".log");
    }

    static String readExcerpt(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return null;
        }
        try {
            String content = Files.readString(path);
            if (content.isEmpty()) {
                return null;
            }
            return content.length() > CRASH_LOG_EXCERPT_CHARS ? content.substring(0, CRASH_LOG_EXCERPT_CHARS) : content;
        } catch (IOException e) {
            logger.warn("could not read crash log {}: {}", path, e.getMessage());
            return null;
        }
    }

    static void deleteCrashLog(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("could not delete crash log {}: {}", path, e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

}
