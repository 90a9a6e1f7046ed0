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
package io.xunitbridge.tree;

/**
 * A node of the host test tree, either a {@link TestCaseNode} leaf or a {@link TestGroup}.
 * <p>
 * Status is written from the worker reader thread and the cancellation thread
 * and read by the host, hence volatile.
 */
public abstract class TestNode {

    private final String name;
    private TestGroup parent;
    private volatile TestStatus status = TestStatus.READY;
    private volatile String statusMessage;

    protected TestNode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public TestGroup getParent() {
        return parent;
    }

    void setParent(TestGroup parent) {
        this.parent = parent;
    }

    public TestStatus getStatus() {
        return status;
    }

    public void setStatus(TestStatus status) {
        setStatus(status, null);
    }

    public void setStatus(TestStatus status, String message) {
        this.status = status;
        this.statusMessage = message;
    }

    /**
     * Failure message or skip reason of the last outcome, null otherwise.
     */
    public String getStatusMessage() {
        return statusMessage;
    }

    /**
     * Dotted path from the root, excluding the root itself.
     */
    public String getPath() {
        if (parent == null) {
            return name;
        }
        String parentPath = parent.getParent() == null ? null : parent.getPath();
        return parentPath == null ? name : parentPath + "." + name;
    }

    public abstract boolean isLeaf();

    @Override
    public String toString() {
        return name;
    }

}
