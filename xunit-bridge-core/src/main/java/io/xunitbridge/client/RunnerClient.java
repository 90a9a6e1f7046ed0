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

import io.xunitbridge.protocol.DiscoveryRequest;
import io.xunitbridge.protocol.NameFilter;
import io.xunitbridge.protocol.RunRequest;
import io.xunitbridge.protocol.RuntimeVersion;
import io.xunitbridge.protocol.TestCaseDescriptor;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Owns one worker process for the duration of one run.
 * <p>
 * Futures returned here complete exceptionally with {@link ConnectionException},
 * {@link WorkerCrashedException}, {@link RunCanceledException} or
 * {@link RunFaultedException}. Only one discover or run operation may be in
 * flight at a time. A client is never reused once closed.
 */
public interface RunnerClient extends AutoCloseable {

    /**
     * Start the worker and wait for its handshake.
     */
    CompletableFuture<Void> connect(RuntimeVersion version, ExecutionHandler handler);

    /**
     * Ask the worker to discover the test cases of an assembly.
     *
     * @param filter optional, null keeps every discovered test case
     */
    CompletableFuture<List<TestCaseDescriptor>> discover(DiscoveryRequest request, Predicate<TestCaseDescriptor> filter);

    /**
     * Ask the worker to run test cases, streaming what it reports to {@code monitor}.
     * Completes normally once the worker reported the end of the run.
     *
     * @param before optional hook run before the request is sent
     * @param after  optional hook run once the run finished
     */
    CompletableFuture<Void> run(TestMonitor monitor, RunRequest request, RunHook before, RunHook after);

    default CompletableFuture<Void> run(TestMonitor monitor, Collection<String> filterIds, String assemblyPath,
                                        String configPath, List<String> supportAssemblies,
                                        RunHook before, RunHook after, Path crashLogPath) {
        NameFilter filter = filterIds == null || filterIds.isEmpty() ? NameFilter.all() : NameFilter.of(filterIds);
        return run(monitor, new RunRequest(assemblyPath, configPath, filter, supportAssemblies, crashLogPath), before, after);
    }

    /**
     * Release the worker. Idempotent, and safe to call from another thread while
     * an operation is in flight, in which case that operation fails with
     * {@link RunCanceledException}.
     */
    @Override
    void close();

}
