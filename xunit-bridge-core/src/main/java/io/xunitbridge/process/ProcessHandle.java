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
package io.xunitbridge.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Worker process wrapper.
 * Manages process lifecycle, line-oriented stdin/stdout, and event dispatch.
 * <p>
 * Supports two creation modes:
 * 1. Immediate start: ProcessHandle.start(config) - starts process immediately
 * 2. Deferred start: ProcessHandle.create(config) then handle.start() - allows setup before start
 * <p>
 * The EXIT event is dispatched only after the output readers have drained, so a
 * listener always sees every line the process wrote before it sees the exit.
 */
public class ProcessHandle {

    private static final Logger logger = LoggerFactory.getLogger(ProcessHandle.class);

    private static final long DRAIN_TIMEOUT_MILLIS = 5000;
    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final ProcessConfig config;
    private Process process;
    private BufferedWriter stdin;
    private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
    private final Set<Thread> readerThreads = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Consumer<ProcessEvent>> eventListeners = new CopyOnWriteArrayList<>();

    private ExecutorService executor;
    private volatile int exitCode = -1;

    private ProcessHandle(ProcessConfig config) {
        this.config = config;
    }

    /**
     * Create ProcessHandle without starting the process.
     * Call start() to begin execution.
     */
    public static ProcessHandle create(ProcessConfig config) {
        return new ProcessHandle(config);
    }

    /**
     * Create and immediately start ProcessHandle.
     */
    public static ProcessHandle start(ProcessConfig config) {
        ProcessHandle handle = new ProcessHandle(config);
        handle.start();
        return handle;
    }

    /**
     * Start the process. Can only be called once.
     *
     * @throws IllegalStateException if already started
     * @throws ProcessStartException if the process cannot be launched
     */
    public ProcessHandle start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("process already started");
        }
        java.lang.ProcessBuilder pb = new java.lang.ProcessBuilder(config.args());
        if (config.workingDir() != null) {
            pb.directory(config.workingDir().toFile());
        }
        if (!config.env().isEmpty()) {
            pb.environment().putAll(config.env());
        }
        pb.redirectErrorStream(config.redirectErrorStream());
        logger.debug("starting process: {}", config.args());
        try {
            this.process = pb.start();
        } catch (IOException e) {
            throw new ProcessStartException("failed to start process " + config.args() + ": " + e.getMessage(), e);
        }
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.executor = Executors.newCachedThreadPool(readerThreads("worker-" + COUNTER.incrementAndGet()));
        Future<?> stdoutReader = executor.submit(() -> readLines(ProcessEvent.Type.STDOUT));
        Future<?> stderrReader = config.redirectErrorStream()
                ? CompletableFuture.completedFuture(null)
                : executor.submit(() -> readLines(ProcessEvent.Type.STDERR));
        executor.submit(() -> waitForExit(stdoutReader, stderrReader));
        return this;
    }

    private ThreadFactory readerThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            readerThreads.add(thread);
            return thread;
        };
    }

    /**
     * Add an event listener. Can be called before or after start().
     */
    public ProcessHandle onEvent(Consumer<ProcessEvent> listener) {
        eventListeners.add(listener);
        return this;
    }

    private void readLines(ProcessEvent.Type type) {
        boolean stdout = type == ProcessEvent.Type.STDOUT;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                stdout ? process.getInputStream() : process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                dispatchEvent(stdout ? ProcessEvent.stdout(line) : ProcessEvent.stderr(line));
            }
        } catch (IOException e) {
            if (!closed.get()) {
                logger.warn("{} reader error: {}", type.name().toLowerCase(), e.getMessage());
            }
        }
    }

    private void waitForExit(Future<?> stdoutReader, Future<?> stderrReader) {
        try {
            int code = process.waitFor();
            drain(stdoutReader);
            drain(stderrReader);
            exitCode = code;
            logger.debug("process exited with code: {}", code);
            dispatchEvent(ProcessEvent.exit(code));
            exitFuture.complete(code);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitFuture.completeExceptionally(e);
        } finally {
            executor.shutdown();
        }
    }

    private void drain(Future<?> reader) throws InterruptedException {
        try {
            reader.get(DRAIN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("output reader did not finish within {}ms after exit", DRAIN_TIMEOUT_MILLIS);
            reader.cancel(true);
        } catch (java.util.concurrent.ExecutionException e) {
            logger.warn("output reader failed: {}", e.getCause().getMessage());
        }
    }

    private void dispatchEvent(ProcessEvent event) {
        if (config.listener() != null) {
            try {
                config.listener().accept(event);
            } catch (Exception e) {
                logger.warn("listener error: {}", e.getMessage(), e);
            }
        }
        for (Consumer<ProcessEvent> listener : eventListeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                logger.warn("event listener error: {}", e.getMessage(), e);
            }
        }
    }

    // ========== Public API ==========

    /**
     * Write one line to the process stdin and flush.
     *
     * @throws IOException if the process no longer accepts input
     */
    public void send(String line) throws IOException {
        if (stdin == null) {
            throw new IllegalStateException("process not started");
        }
        synchronized (stdin) {
            stdin.write(line);
            stdin.newLine();
            stdin.flush();
        }
    }

    public int waitSync(long timeoutMillis) {
        try {
            return exitFuture.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IllegalStateException("process still running after " + timeoutMillis + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for process", e);
        } catch (Exception e) {
            throw new IllegalStateException("error waiting for process", e);
        }
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isAlive() {
        return process != null && process.isAlive();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void close() {
        close(false);
    }

    /**
     * Stop the process. Safe to call more than once and from any thread.
     *
     * @param force kill immediately instead of asking the process to terminate
     */
    public void close(boolean force) {
        if (closed.compareAndSet(false, true) && process != null) {
            if (force) {
                process.destroyForcibly();
            } else {
                process.destroy();
            }
            try {
                stdin.close();
            } catch (IOException e) {
                logger.debug("stdin already closed: {}", e.getMessage());
            }
            logger.debug("process closed (force={})", force);
        }
    }

    public long getPid() {
        return process.pid();
    }

    public CompletableFuture<Integer> getExitFuture() {
        return exitFuture;
    }

    /**
     * True when called from one of the threads that read output and dispatch events
     * for this process. Such a caller must not block on {@link #getExitFuture()}.
     */
    public boolean isEventThread() {
        return readerThreads.contains(Thread.currentThread());
    }

}
