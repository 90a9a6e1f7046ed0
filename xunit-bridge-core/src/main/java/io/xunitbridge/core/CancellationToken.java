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

import io.xunitbridge.client.RunCanceledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Host-owned signal asking a run to stop. Obtained from a {@link CancellationSource}.
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    /**
     * A token that is never canceled.
     */
    public static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean canceled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Entry> entries = new CopyOnWriteArrayList<>();

    CancellationToken() {
    }

    public boolean isCancellationRequested() {
        return canceled.get();
    }

    public void throwIfCancellationRequested() {
        if (canceled.get()) {
            throw new RunCanceledException("cancellation requested");
        }
    }

    /**
     * Run {@code action} once when cancellation is requested. If it already was,
     * the action runs right away on the calling thread.
     */
    public CancellationRegistration register(Runnable action) {
        Entry entry = new Entry(action);
        entries.add(entry);
        if (canceled.get()) {
            entry.fire();
        }
        return entry;
    }

    boolean cancel() {
        if (this == NONE || !canceled.compareAndSet(false, true)) {
            return false;
        }
        logger.debug("cancellation requested, {} action(s) registered", entries.size());
        for (Entry entry : entries) {
            entry.fire();
        }
        return true;
    }

    private final class Entry implements CancellationRegistration {

        final Runnable action;
        final AtomicBoolean done = new AtomicBoolean(false);

        Entry(Runnable action) {
            this.action = action;
        }

        void fire() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            entries.remove(this);
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.warn("cancellation action failed: {}", e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            if (done.compareAndSet(false, true)) {
                entries.remove(this);
            }
        }

    }

}
