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

import io.xunitbridge.common.Messages;
import io.xunitbridge.tree.TestNode;
import io.xunitbridge.tree.TestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One run of a target node, from creation until its result is known.
 * <p>
 * The session moves {@code CREATED -> ACTIVE -> COMPLETED | CANCELED | FAILED}.
 * Exactly one terminal transition happens, later attempts are ignored. Closing a
 * session that has no result yet fails it, so every session ends with a result
 * and a closed console.
 */
public class ExecutionSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionSession.class);

    private final TestNode target;
    private final ResultListener listener;
    private final TestConsole console;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CREATED);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CompletableFuture<UnitTestResult> resultFuture = new CompletableFuture<>();
    private final long startTime = System.currentTimeMillis();

    private volatile UnitTestResult result;

    private ExecutionSession(TestNode target, ResultListener listener, TestConsole console) {
        this.target = target;
        this.listener = listener;
        this.console = console;
    }

    public static ExecutionSession create(TestNode target, TestContext context, boolean reportToMonitor) {
        ResultListener listener = reportToMonitor ? context.getResultListener() : ResultListener.NONE;
        return new ExecutionSession(target, listener, new TestConsole(context.getConsole()));
    }

    public static ExecutionSession create(TestNode target, TestContext context) {
        return create(target, context, context.isReportToMonitor());
    }

    /**
     * The worker confirmed what it is going to run.
     *
     * @return false if the session was not in the CREATED state
     */
    public boolean activate() {
        if (!state.compareAndSet(SessionState.CREATED, SessionState.ACTIVE)) {
            return false;
        }
        logger.debug("session active: {}", target);
        updateStatus(target, TestStatus.RUNNING, null);
        return true;
    }

    public boolean complete(UnitTestResult result) {
        return finish(SessionState.COMPLETED, result);
    }

    public boolean cancel(UnitTestResult result) {
        return finish(SessionState.CANCELED, result);
    }

    public boolean fail(UnitTestResult result) {
        return finish(SessionState.FAILED, result);
    }

    private boolean finish(SessionState next, UnitTestResult result) {
        SessionState current;
        do {
            current = state.get();
            if (current.isTerminal()) {
                logger.debug("session already {}, ignoring {}", current, next);
                return false;
            }
        } while (!state.compareAndSet(current, next));
        if (result.getDuration().isZero()) {
            result.setDuration(Duration.ofMillis(System.currentTimeMillis() - startTime));
        }
        this.result = result;
        logger.debug("session {}: {}", next, result);
        switch (next) {
            case COMPLETED -> updateStatus(target, result.isPassed() ? TestStatus.PASSED : TestStatus.FAILED, result.getMessage());
            case CANCELED -> updateStatus(target, TestStatus.READY, null);
            default -> updateStatus(target, TestStatus.FAILED, result.getMessage());
        }
        resultFuture.complete(result);
        return true;
    }

    /**
     * Set a node's status and tell the host about it.
     */
    void updateStatus(TestNode node, TestStatus status, String message) {
        node.setStatus(status, message);
        try {
            listener.onStatusChanged(node, status);
        } catch (RuntimeException e) {
            logger.warn("result listener failed for {}: {}", node, e.getMessage());
        }
    }

    public TestConsole getConsole() {
        return console;
    }

    public TestNode getTarget() {
        return target;
    }

    public SessionState getState() {
        return state.get();
    }

    /**
     * The aggregate result, null until the session reached a terminal state.
     */
    public UnitTestResult getResult() {
        return result;
    }

    public CompletableFuture<UnitTestResult> resultFuture() {
        return resultFuture;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!state.get().isTerminal()) {
            fail(UnitTestResult.createFailure(Messages.get("run.sessionAborted"), null));
        }
        console.close();
        try {
            listener.onRunEnd(this);
        } catch (RuntimeException e) {
            logger.warn("result listener failed at end of run: {}", e.getMessage());
        }
    }

}
