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

import io.xunitbridge.client.TestMonitor;
import io.xunitbridge.common.Messages;
import io.xunitbridge.protocol.ResultEvent;
import io.xunitbridge.protocol.TestCaseDescriptor;
import io.xunitbridge.tree.TestCaseAggregator;
import io.xunitbridge.tree.TestCaseNode;
import io.xunitbridge.tree.TestNode;
import io.xunitbridge.tree.TestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies the worker's result events to the host test tree and keeps the
 * aggregate of one run.
 * <p>
 * A node only becomes terminal after it was started, and only once. Events that
 * break this order, or name a test case that is not part of the run, are logged
 * and dropped.
 */
public class LocalTestMonitor implements TestMonitor {

    private static final Logger logger = LoggerFactory.getLogger(LocalTestMonitor.class);

    private final ExecutionSession session;
    private final Map<String, TestCaseNode> nodes = new ConcurrentHashMap<>();
    private final Set<String> started = ConcurrentHashMap.newKeySet();
    private final Set<String> finished = ConcurrentHashMap.newKeySet();
    private final UnitTestResult result = new UnitTestResult();

    private volatile boolean canceled;
    private volatile boolean runFinished;

    public LocalTestMonitor(ExecutionSession session, Collection<TestCaseDescriptor> testCases) {
        this.session = session;
        for (TestCaseDescriptor testCase : testCases) {
            if (testCase.getSource() instanceof TestCaseNode node) {
                nodes.put(testCase.getId(), node);
            } else {
                logger.warn("test case has no tree node, its results will be ignored: {}", testCase.getId());
            }
        }
    }

    @Override
    public void onDiscoveryComplete(List<TestCaseDescriptor> testCases) {
        long unknown = testCases.stream().filter(tc -> !nodes.containsKey(tc.getId())).count();
        if (unknown > 0) {
            logger.debug("worker discovered {} test case(s) outside this run", unknown);
        }
        session.activate();
    }

    /**
     * Serialized with {@link #setCanceled()}, so once that returns no event can
     * change a node any more.
     */
    @Override
    public synchronized void onEvent(ResultEvent event) {
        if (canceled) {
            logger.debug("run canceled, ignoring: {}", event);
            return;
        }
        if (event instanceof ResultEvent.RunFinished) {
            onRunFinished();
            return;
        }
        String id = ResultEvent.testId(event);
        TestCaseNode node = nodes.get(id);
        if (node == null) {
            logger.warn("result for unknown test case ignored: {}", event);
            return;
        }
        if (event instanceof ResultEvent.TestStarted) {
            if (!started.add(id)) {
                logger.warn("test case started twice, ignoring: {}", id);
                return;
            }
            session.updateStatus(node, TestStatus.RUNNING, null);
            return;
        }
        if (!started.contains(id)) {
            logger.warn("result before start, ignoring: {}", event);
            return;
        }
        if (!finished.add(id)) {
            logger.warn("second result for test case, ignoring: {}", event);
            return;
        }
        if (event instanceof ResultEvent.TestPassed) {
            result.addPassed();
            session.updateStatus(node, TestStatus.PASSED, null);
        } else if (event instanceof ResultEvent.TestFailed failed) {
            result.addFailure(new TestFailure(id, node.getDescriptor().getDisplayName(),
                    failed.message(), failed.stackTrace()));
            session.updateStatus(node, TestStatus.FAILED, failed.message());
        } else if (event instanceof ResultEvent.TestSkipped skipped) {
            result.addSkipped();
            session.updateStatus(node, TestStatus.SKIPPED, skipped.reason());
        }
    }

    private void onRunFinished() {
        runFinished = true;
        String message = Messages.get("run.noResult");
        for (String id : started) {
            if (finished.add(id)) {
                TestCaseNode node = nodes.get(id);
                logger.warn("test case did not report a result: {}", id);
                result.addFailure(new TestFailure(id, node.getDescriptor().getDisplayName(), message, null));
                session.updateStatus(node, TestStatus.FAILED, message);
            }
        }
    }

    /**
     * Put every running node under {@code root} back to ready.
     */
    public void resetRunning(TestNode root) {
        TestCaseAggregator.walk(root, node -> {
            if (node.getStatus() == TestStatus.RUNNING) {
                session.updateStatus(node, TestStatus.READY, null);
            }
        });
    }

    public synchronized void setCanceled() {
        canceled = true;
    }

    public boolean isCanceled() {
        return canceled;
    }

    public boolean isRunFinished() {
        return runFinished;
    }

    public UnitTestResult buildResult() {
        return result;
    }

}
