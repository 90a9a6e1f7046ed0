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

import io.xunitbridge.protocol.ResultEvent;
import io.xunitbridge.protocol.TestCaseDescriptor;
import io.xunitbridge.tree.TestCaseAggregator;
import io.xunitbridge.tree.TestCaseNode;
import io.xunitbridge.tree.TestGroup;
import io.xunitbridge.tree.TestNode;
import io.xunitbridge.tree.TestStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class LocalTestMonitorTest {

    TestGroup root;
    TestCaseNode a;
    TestCaseNode b;
    ExecutionSession session;
    LocalTestMonitor monitor;
    final List<String> changes = new CopyOnWriteArrayList<>();

    @BeforeEach
    void beforeEach() {
        root = new TestGroup("root");
        a = root.add(new TestCaseNode("a", "Tests.a", "Tests"));
        b = root.add(new TestCaseNode("b", "Tests.b", "Tests"));
        ResultListener listener = new ResultListener() {
            @Override
            public void onStatusChanged(TestNode node, TestStatus status) {
                changes.add(node.getName() + ":" + status);
            }
        };
        TestContext context = TestContext.builder(new BridgeConfig())
                .executionHandler(version -> {
                    throw new UnsupportedOperationException();
                })
                .resultListener(listener)
                .build();
        session = ExecutionSession.create(root, context);
        List<TestCaseDescriptor> testCases = TestCaseAggregator.flatten(root);
        monitor = new LocalTestMonitor(session, testCases);
    }

    @Test
    void testStartedThenPassed() {
        monitor.onEvent(new ResultEvent.TestStarted("a"));
        assertEquals(TestStatus.RUNNING, a.getStatus());
        monitor.onEvent(new ResultEvent.TestPassed("a", Duration.ofMillis(3)));
        assertEquals(TestStatus.PASSED, a.getStatus());
        assertEquals(1, monitor.buildResult().getPassedCount());
        assertEquals(List.of("Tests.a:RUNNING", "Tests.a:PASSED"), changes);
    }

    @Test
    void testTerminalWithoutStartIsIgnored() {
        monitor.onEvent(new ResultEvent.TestPassed("a", Duration.ZERO));
        assertEquals(TestStatus.READY, a.getStatus());
        assertEquals(0, monitor.buildResult().getTotalCount());
    }

    @Test
    void testSecondTerminalIsIgnored() {
        monitor.onEvent(new ResultEvent.TestStarted("a"));
        monitor.onEvent(new ResultEvent.TestFailed("a", "boom", null));
        monitor.onEvent(new ResultEvent.TestPassed("a", Duration.ZERO));
        assertEquals(TestStatus.FAILED, a.getStatus());
        assertEquals("boom", a.getStatusMessage());
        UnitTestResult result = monitor.buildResult();
        assertEquals(1, result.getFailedCount());
        assertEquals(0, result.getPassedCount());
        assertEquals("Tests.a", result.getFailures().get(0).displayName());
    }

    @Test
    void testUnknownIdIsIgnored() {
        monitor.onEvent(new ResultEvent.TestStarted("zzz"));
        monitor.onEvent(new ResultEvent.TestPassed("zzz", Duration.ZERO));
        assertEquals(0, monitor.buildResult().getTotalCount());
        assertTrue(changes.isEmpty());
    }

    @Test
    void testRunFinishedFailsRunningNodes() {
        monitor.onEvent(new ResultEvent.TestStarted("a"));
        monitor.onEvent(new ResultEvent.TestStarted("b"));
        monitor.onEvent(new ResultEvent.TestSkipped("b", "slow"));
        monitor.onEvent(new ResultEvent.RunFinished());
        assertTrue(monitor.isRunFinished());
        assertEquals(TestStatus.FAILED, a.getStatus());
        assertEquals(TestStatus.SKIPPED, b.getStatus());
        assertEquals("slow", b.getStatusMessage());
        assertEquals(1, monitor.buildResult().getFailedCount());
        assertEquals(1, monitor.buildResult().getSkippedCount());
    }

    @Test
    void testCanceledMonitorLeavesNodesForReset() {
        monitor.onEvent(new ResultEvent.TestStarted("a"));
        monitor.setCanceled();
        monitor.onEvent(new ResultEvent.TestPassed("a", Duration.ZERO));
        monitor.onEvent(new ResultEvent.RunFinished());
        assertTrue(monitor.isCanceled());
        assertEquals(TestStatus.RUNNING, a.getStatus());
        monitor.resetRunning(root);
        assertEquals(TestStatus.READY, a.getStatus());
        assertEquals(0, monitor.buildResult().getTotalCount());
    }

    @Test
    void testDiscoveryCompleteActivatesSession() {
        assertEquals(SessionState.CREATED, session.getState());
        monitor.onDiscoveryComplete(List.of(a.getDescriptor()));
        assertEquals(SessionState.ACTIVE, session.getState());
        assertEquals(TestStatus.RUNNING, root.getStatus());
    }

    @Test
    void testResetRunningIncludesTarget() {
        monitor.onDiscoveryComplete(List.of());
        monitor.onEvent(new ResultEvent.TestStarted("b"));
        monitor.resetRunning(root);
        assertEquals(TestStatus.READY, root.getStatus());
        assertEquals(TestStatus.READY, b.getStatus());
    }

}
