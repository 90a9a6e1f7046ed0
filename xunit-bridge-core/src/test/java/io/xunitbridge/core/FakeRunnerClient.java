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

import io.xunitbridge.client.ExecutionHandler;
import io.xunitbridge.client.RunCanceledException;
import io.xunitbridge.client.RunHook;
import io.xunitbridge.client.RunnerClient;
import io.xunitbridge.client.TestMonitor;
import io.xunitbridge.protocol.DiscoveryRequest;
import io.xunitbridge.protocol.RunRequest;
import io.xunitbridge.protocol.RuntimeVersion;
import io.xunitbridge.protocol.TestCaseDescriptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory client whose run behavior is scripted by the test.
 */
class FakeRunnerClient implements RunnerClient {

    interface RunScript {
        CompletableFuture<Void> run(FakeRunnerClient client, TestMonitor monitor, RunRequest request);
    }

    final List<String> calls = new CopyOnWriteArrayList<>();
    final Consumer<String> console;
    final RunScript script;
    CompletableFuture<Void> connectResult = CompletableFuture.completedFuture(null);
    volatile RunRequest request;
    volatile CompletableFuture<Void> pending;

    FakeRunnerClient(Consumer<String> console, RunScript script) {
        this.console = console;
        this.script = script;
    }

    @Override
    public CompletableFuture<Void> connect(RuntimeVersion version, ExecutionHandler handler) {
        calls.add("connect");
        return connectResult;
    }

    @Override
    public CompletableFuture<List<TestCaseDescriptor>> discover(DiscoveryRequest request, Predicate<TestCaseDescriptor> filter) {
        throw new UnsupportedOperationException();
    }

    @Override
    public CompletableFuture<Void> run(TestMonitor monitor, RunRequest request, RunHook before, RunHook after) {
        calls.add("run");
        this.request = request;
        return script.run(this, monitor, request);
    }

    /**
     * A run that only ends when the client is closed.
     */
    CompletableFuture<Void> pendingRun() {
        pending = new CompletableFuture<>();
        return pending;
    }

    @Override
    public void close() {
        calls.add("close");
        console.accept("client closed");
        CompletableFuture<Void> run = pending;
        if (run != null) {
            run.completeExceptionally(new RunCanceledException("closed"));
        }
    }

}
