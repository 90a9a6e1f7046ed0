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

import io.xunitbridge.client.RunnerClient;
import io.xunitbridge.tree.TestNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What happens when the host cancels a run: the monitor is flagged first, so that
 * the failure the run sees afterwards is reconciled as a cancellation, then the
 * worker is stopped and running nodes go back to ready.
 */
public class RunCancellation implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(RunCancellation.class);

    private final LocalTestMonitor monitor;
    private final RunnerClient client;
    private final TestNode target;
    private final AtomicBoolean done = new AtomicBoolean(false);

    public RunCancellation(LocalTestMonitor monitor, RunnerClient client, TestNode target) {
        this.monitor = monitor;
        this.client = client;
        this.target = target;
    }

    public void cancel() {
        if (!done.compareAndSet(false, true)) {
            return;
        }
        logger.debug("canceling run of {}", target);
        monitor.setCanceled();
        client.close();
        monitor.resetRunning(target);
    }

    @Override
    public void run() {
        cancel();
    }

    public boolean isCanceled() {
        return done.get();
    }

}
