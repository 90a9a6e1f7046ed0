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
package io.xunitbridge.discovery;

import io.xunitbridge.protocol.DiscoveryMessage;
import io.xunitbridge.protocol.TestCaseDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Accumulates discovered test cases until the discovery stream completes.
 * <p>
 * Test cases matching the optional predicate are appended in arrival order, which
 * is the default run order. Nothing is removed or replaced once added. The list is
 * only handed out after {@link DiscoveryMessage.DiscoveryComplete} was visited.
 */
public class DiscoveryCollector implements MessageVisitor<DiscoveryMessage> {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryCollector.class);

    private final Predicate<TestCaseDescriptor> filter;
    private final List<TestCaseDescriptor> testCases = new ArrayList<>();
    private final CompletableFuture<List<TestCaseDescriptor>> completion = new CompletableFuture<>();

    public DiscoveryCollector() {
        this(null);
    }

    /**
     * @param filter optional, null accepts every discovered test case
     */
    public DiscoveryCollector(Predicate<TestCaseDescriptor> filter) {
        this.filter = filter;
    }

    /**
     * Collect a finite, already available message stream.
     *
     * @throws IllegalStateException if the stream ends without a DiscoveryComplete message
     */
    public static List<TestCaseDescriptor> collect(Iterable<? extends DiscoveryMessage> messages,
                                                   Predicate<TestCaseDescriptor> filter) {
        DiscoveryCollector collector = new DiscoveryCollector(filter);
        for (DiscoveryMessage message : messages) {
            if (!collector.visit(message)) {
                break;
            }
        }
        if (!collector.isComplete()) {
            throw new IllegalStateException("discovery stream ended without completion");
        }
        return collector.getTestCases().join();
    }

    @Override
    public synchronized boolean visit(DiscoveryMessage message) {
        if (completion.isDone()) {
            logger.debug("discovery already complete, ignoring: {}", message);
            return false;
        }
        if (message instanceof DiscoveryMessage.TestCaseDiscovered discovered) {
            TestCaseDescriptor testCase = discovered.testCase();
            if (filter == null || filter.test(testCase)) {
                testCases.add(testCase);
            }
            return true;
        }
        completion.complete(List.copyOf(testCases));
        logger.debug("discovery complete: {} test case(s)", testCases.size());
        return false;
    }

    /**
     * Fail a pending discovery, e.g. because the worker went away.
     * Has no effect if discovery already completed.
     */
    public void fail(Throwable error) {
        completion.completeExceptionally(error);
    }

    public boolean isComplete() {
        return completion.isDone() && !completion.isCompletedExceptionally();
    }

    /**
     * Completes with the collected test cases once discovery completed.
     */
    public CompletableFuture<List<TestCaseDescriptor>> getTestCases() {
        return completion;
    }

    public List<TestCaseDescriptor> awaitTestCases(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException("discovery failed", cause);
        }
    }

}
