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
package io.xunitbridge.client;

import io.xunitbridge.discovery.DiscoveryCollector;
import io.xunitbridge.process.ProcessConfig;
import io.xunitbridge.process.ProcessEvent;
import io.xunitbridge.process.ProcessHandle;
import io.xunitbridge.protocol.DiscoveryMessage;
import io.xunitbridge.protocol.DiscoveryRequest;
import io.xunitbridge.protocol.MessageCodec;
import io.xunitbridge.protocol.ResultEvent;
import io.xunitbridge.protocol.RunRequest;
import io.xunitbridge.protocol.RuntimeVersion;
import io.xunitbridge.protocol.TestCaseDescriptor;
import io.xunitbridge.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * {@link RunnerClient} talking to a worker process over JSON Lines on stdin/stdout.
 * <p>
 * Every worker line is handled on the process reader thread in arrival order.
 * Lines that are not protocol messages, and everything on stderr, go to the console
 * consumer. The worker exiting while an operation is in flight fails that operation:
 * with {@link RunCanceledException} if this client was closed, with
 * {@link WorkerCrashedException} otherwise.
 */
public class ProcessRunnerClient implements RunnerClient {

    private static final Logger logger = LoggerFactory.getLogger(ProcessRunnerClient.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final long EXIT_GRACE_MILLIS = 2000;

    private final Duration connectTimeout;
    private final Consumer<String> console;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<Operation> current = new AtomicReference<>();
    private final CompletableFuture<Void> handshake = new CompletableFuture<>();

    private volatile ProcessHandle process;
    private volatile RuntimeVersion runtimeVersion;

    public ProcessRunnerClient() {
        this(DEFAULT_CONNECT_TIMEOUT, line -> logger.info("[worker] {}", line));
    }

    /**
     * @param connectTimeout how long to wait for the worker handshake
     * @param console        receives worker output that is not a protocol message
     */
    public ProcessRunnerClient(Duration connectTimeout, Consumer<String> console) {
        this.connectTimeout = connectTimeout;
        this.console = console;
    }

    @Override
    public CompletableFuture<Void> connect(RuntimeVersion version, ExecutionHandler handler) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new ConnectionException("client already closed"));
        }
        if (process != null) {
            throw new IllegalStateException("client already connected");
        }
        runtimeVersion = version;
        try {
            ProcessConfig config = handler.prepare(version);
            ProcessHandle handle = ProcessHandle.create(config).onEvent(this::onProcessEvent);
            process = handle;
            handle.start();
            logger.debug("worker started, pid {}", handle.getPid());
        } catch (RuntimeException e) {
            handshake.completeExceptionally(new ConnectionException("could not start worker: " + e.getMessage(), e));
        }
        return handshake
                .orTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error == null) {
                        return null;
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        throw new ConnectionException("worker did not complete the handshake within "
                                + connectTimeout.toMillis() + "ms");
                    }
                    if (cause instanceof ConnectionException ce) {
                        throw ce;
                    }
                    throw new ConnectionException(cause.getMessage(), cause);
                });
    }

    @Override
    public CompletableFuture<List<TestCaseDescriptor>> discover(DiscoveryRequest request,
                                                                Predicate<TestCaseDescriptor> filter) {
        DiscoverOperation op = new DiscoverOperation(new DiscoveryCollector(filter));
        begin(op, MessageCodec.encodeDiscover(request));
        return op.future;
    }

    @Override
    public CompletableFuture<Void> run(TestMonitor monitor, RunRequest request, RunHook before, RunHook after) {
        RunOperation op = new RunOperation(monitor, request, after);
        if (before != null) {
            try {
                before.execute(request);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(new RunFaultedException("before-run hook failed: " + e.getMessage(), e));
            }
        }
        begin(op, MessageCodec.encodeRun(request));
        return op.future;
    }

    private void begin(Operation op, String line) {
        if (closed.get()) {
            op.fail(new RunCanceledException("client already closed"));
            return;
        }
        if (process == null || !handshake.isDone() || handshake.isCompletedExceptionally()) {
            throw new IllegalStateException("client is not connected");
        }
        if (!current.compareAndSet(null, op)) {
            throw new IllegalStateException("another operation is already in progress");
        }
        if (closed.get()) {
            finish(op, new RunCanceledException("client closed before the request was sent"));
            return;
        }
        try {
            process.send(line);
        } catch (IOException e) {
            if (current.compareAndSet(op, null)) {
                op.fail(closed.get()
                        ? new RunCanceledException("client closed while sending request")
                        : new RunFaultedException("could not send request to worker: " + e.getMessage(), e));
            }
        }
    }

    private void finish(Operation op, Throwable error) {
        if (current.compareAndSet(op, null)) {
            if (error == null) {
                op.succeed();
            } else {
                op.fail(error);
            }
        }
    }

    // ========== Worker output ==========

    private void onProcessEvent(ProcessEvent event) {
        switch (event.type()) {
            case STDOUT -> onLine(event.data());
            case STDERR -> console.accept(event.data());
            case EXIT -> onExit(event.exitCode());
        }
    }

    private void onLine(String line) {
        WorkerMessage message;
        try {
            message = MessageCodec.decode(line);
        } catch (IllegalArgumentException e) {
            Operation op = current.get();
            if (op != null) {
                finish(op, new RunFaultedException("malformed worker message: " + e.getMessage(), e));
            } else {
                logger.warn("malformed worker message: {}", e.getMessage());
            }
            return;
        }
        if (message == null) {
            console.accept(line);
        } else if (message instanceof WorkerMessage.Ready ready) {
            onReady(ready);
        } else {
            Operation op = current.get();
            if (op == null) {
                logger.warn("worker message with no operation in flight: {}", message);
            } else {
                try {
                    op.onMessage(message);
                } catch (RuntimeException e) {
                    finish(op, new RunFaultedException("failed to process worker message: " + e.getMessage(), e));
                }
            }
        }
    }

    private void onReady(WorkerMessage.Ready ready) {
        if (handshake.isDone()) {
            logger.warn("ignoring repeated handshake from worker");
            return;
        }
        String announced = ready.runtimeVersion();
        if (announced != null && !announced.equalsIgnoreCase(runtimeVersion.getWireName())) {
            handshake.completeExceptionally(new ConnectionException("worker hosts runtime '" + announced
                    + "' but '" + runtimeVersion.getWireName() + "' was requested"));
            return;
        }
        logger.debug("worker handshake complete ({})", runtimeVersion.getWireName());
        handshake.complete(null);
    }

    private void onExit(int exitCode) {
        if (!handshake.isDone()) {
            handshake.completeExceptionally(new ConnectionException("worker exited with code " + exitCode
                    + " before completing the handshake"));
        }
        Operation op = current.getAndSet(null);
        if (op != null) {
            if (closed.get()) {
                op.fail(new RunCanceledException("worker stopped because the client was closed"));
            } else {
                logger.debug("worker exited with code {} during an operation", exitCode);
                op.fail(new WorkerCrashedException(exitCode, op.crashLogPath()));
            }
        }
    }

    // ========== Lifecycle ==========

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ProcessHandle handle = process;
        if (handle == null) {
            return;
        }
        if (current.get() != null || !handshake.isDone() || handshake.isCompletedExceptionally()) {
            handle.close(true);
            awaitExit(handle);
            return;
        }
        try {
            handle.send(MessageCodec.encodeExit());
            handle.getExitFuture().get(EXIT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.debug("worker did not exit on request: {}", e.getMessage());
        } finally {
            handle.close(false);
        }
    }

    // the exit event is dispatched only after all worker output was read
    private static void awaitExit(ProcessHandle handle) {
        if (handle.isEventThread()) {
            return;
        }
        try {
            handle.getExitFuture().get(EXIT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.debug("worker did not exit after kill: {}", e.getMessage());
        }
    }

        public boolean isClosed() {
        return closed.get();
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    // ========== Operations ==========

    private abstract static class Operation {

        abstract void onMessage(WorkerMessage message);

        abstract void succeed();

        abstract void fail(Throwable error);

        Path crashLogPath() {
            return null;
        }

    }

    private class DiscoverOperation extends Operation {

        final DiscoveryCollector collector;
        final CompletableFuture<List<TestCaseDescriptor>> future = new CompletableFuture<>();

        DiscoverOperation(DiscoveryCollector collector) {
            this.collector = collector;
        }

        @Override
        void onMessage(WorkerMessage message) {
            if (message instanceof DiscoveryMessage discovery) {
                if (!collector.visit(discovery)) {
                    finish(this, null);
                }
            } else if (message instanceof WorkerMessage.Error error) {
                finish(this, new RunFaultedException(error.message(), error.code()));
            } else {
                logger.warn("unexpected message during discovery: {}", message);
            }
        }

        @Override
        void succeed() {
            future.complete(collector.getTestCases().join());
        }

        @Override
        void fail(Throwable error) {
            collector.fail(error);
            future.completeExceptionally(error);
        }

    }

    private class RunOperation extends Operation {

        final TestMonitor monitor;
        final RunRequest request;
        final RunHook after;
        final DiscoveryCollector collector = new DiscoveryCollector();
        final CompletableFuture<Void> future = new CompletableFuture<>();

        RunOperation(TestMonitor monitor, RunRequest request, RunHook after) {
            this.monitor = monitor;
            this.request = request;
            this.after = after;
        }

        @Override
        void onMessage(WorkerMessage message) {
            if (message instanceof DiscoveryMessage discovery) {
                boolean wasComplete = collector.isComplete();
                if (!collector.visit(discovery) && !wasComplete) {
                    monitor.onDiscoveryComplete(collector.getTestCases().join());
                }
            } else if (message instanceof ResultEvent event) {
                monitor.onEvent(event);
                if (event instanceof ResultEvent.RunFinished) {
                    finish(this, runAfterHook());
                }
            } else if (message instanceof WorkerMessage.Error error) {
                finish(this, new RunFaultedException(error.message(), error.code()));
            }
        }

        private Throwable runAfterHook() {
            if (after == null) {
                return null;
            }
            try {
                after.execute(request);
                return null;
            } catch (Exception e) {
                return new RunFaultedException("after-run hook failed: " + e.getMessage(), e);
            }
        }

        @Override
        void succeed() {
            future.complete(null);
        }

        @Override
        void fail(Throwable error) {
            future.completeExceptionally(error);
        }

        @Override
        Path crashLogPath() {
            return request.crashLogPath();
        }

    }

}
