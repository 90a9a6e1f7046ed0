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

import io.xunitbridge.tree.TestNode;
import io.xunitbridge.tree.TestStatus;

/**
 * Receives host test tree updates as a run progresses.
 * <p>
 * Purely observational. Callbacks arrive on the worker reader thread, or on the
 * thread that requested cancellation, and must not block.
 */
public interface ResultListener {

    ResultListener NONE = new ResultListener() {
    };

    /**
     * Called after a node moved to a new status.
     *
     * @param node   the node, a test case or the run target
     * @param status the status the node now has
     */
    default void onStatusChanged(TestNode node, TestStatus status) {
    }

    /**
     * Called once when the session reached its terminal state.
     */
    default void onRunEnd(ExecutionSession session) {
    }

}
