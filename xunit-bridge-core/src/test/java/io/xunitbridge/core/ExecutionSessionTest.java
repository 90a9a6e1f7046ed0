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

import io.xunitbridge.tree.TestCaseNode;
import io.xunitbridge.tree.TestNode;
import io.xunitbridge.tree.TestStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionSessionTest {

    final TestCaseNode target = new TestCaseNode("t1", "Tests.t1", "Tests");
    final List<String> events = new CopyOnWriteArrayList<>();
    final List<String> console = new CopyOnWriteArrayList<>();

    TestContext context() {
        return TestContext.builder(new BridgeConfig())
                .executionHandler(version -> {
                    throw new UnsupportedOperationException();
                })
                .console(console::add)
                .resultListener(new ResultListener() {
                    @Override
                    public void onStatusChanged(TestNode node, TestStatus status) {
                        events.add(status.name());
                    }

                    @Override
                    public void onRunEnd(ExecutionSession session) {
                        events.add("end:" + session.getState());
                    }
                })
                .build();
    }

    @Test
    void testLifecycle() {
        ExecutionSession session = ExecutionSession.create(target, context());
        assertEquals(SessionState.CREATED, session.getState());
        assertTrue(session.activate());
        assertFalse(session.activate());
        assertEquals(TestStatus.RUNNING, target.getStatus());

        UnitTestResult result = UnitTestResult.empty();
        assertTrue(session.complete(result));
        assertEquals(SessionState.COMPLETED, session.getState());
        assertSame(result, session.getResult());
        assertSame(result, session.resultFuture().join());
        assertEquals(TestStatus.PASSED, target.getStatus());

        session.close();
        assertEquals(List.of("RUNNING", "PASSED", "end:COMPLETED"), events);
    }

    @Test
    void testOnlyFirstTerminalTransitionCounts() {
        ExecutionSession session = ExecutionSession.create(target, context());
        UnitTestResult canceled = UnitTestResult.createCanceled("Canceled");
        assertTrue(session.cancel(canceled));
        assertFalse(session.complete(UnitTestResult.empty()));
        assertFalse(session.fail(UnitTestResult.createFailure(new IllegalStateException("late"))));
        assertEquals(SessionState.CANCELED, session.getState());
        assertSame(canceled, session.getResult());
        assertEquals(TestStatus.READY, target.getStatus());
    }

    @Test
    void testCloseWithoutResultFails() {
        ExecutionSession session = ExecutionSession.create(target, context());
        session.activate();
        session.close();
        session.close();
        assertEquals(SessionState.FAILED, session.getState());
        assertTrue(session.getResult().isFaulted());
        assertEquals("Test run ended without a result", session.getResult().getMessage());
        assertEquals(TestStatus.FAILED, target.getStatus());
        assertTrue(session.getConsole().isClosed());
        assertEquals(1, events.stream().filter(e -> e.startsWith("end:")).count());
    }

    @Test
    void testConsoleClosedWithSession() {
        ExecutionSession session = ExecutionSession.create(target, context());
        session.getConsole().println("before");
        session.complete(UnitTestResult.empty());
        session.close();
        session.getConsole().println("after");
        assertEquals(List.of("before"), console);
    }

    @Test
    void testNotReportingToMonitor() {
        ExecutionSession session = ExecutionSession.create(target, context(), false);
        session.activate();
        session.complete(UnitTestResult.empty());
        session.close();
        assertTrue(events.isEmpty());
        assertEquals(TestStatus.PASSED, target.getStatus());
    }

    @Test
    void testConcurrentTerminalTransitions() throws Exception {
        ExecutionSession session = ExecutionSession.create(target, context());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> futures = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 8; i++) {
            boolean cancel = i % 2 == 0;
            futures.add(executor.submit(() -> {
                go.await();
                return cancel ? session.cancel(UnitTestResult.createCanceled("Canceled")) : session.complete(UnitTestResult.empty());
            }));
        }
        go.countDown();
        int winners = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        executor.shutdown();
        assertEquals(1, winners);
        assertTrue(session.getState().isTerminal());
    }

}
