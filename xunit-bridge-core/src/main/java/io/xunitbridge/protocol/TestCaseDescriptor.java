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
package io.xunitbridge.protocol;

import io.xunitbridge.tree.TestNode;

import java.lang.ref.WeakReference;
import java.util.Objects;

/**
 * Identity and metadata of one discovered test case.
 * <p>
 * The descriptor only holds a weak reference to the host test-tree node it was
 * produced for, the tree owns its nodes. Descriptors decoded from the worker have
 * no source node until {@link #withSource(TestNode)} binds one.
 */
public final class TestCaseDescriptor {

    private final String id;
    private final String displayName;
    private final String typeName;
    private final WeakReference<TestNode> source;

    public TestCaseDescriptor(String id, String displayName) {
        this(id, displayName, null, null);
    }

    public TestCaseDescriptor(String id, String displayName, String typeName) {
        this(id, displayName, typeName, null);
    }

    public TestCaseDescriptor(String id, String displayName, String typeName, TestNode source) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("test case id must not be empty");
        }
        this.id = id;
        this.displayName = displayName == null ? id : displayName;
        this.typeName = typeName;
        this.source = source == null ? null : new WeakReference<>(source);
    }

    public TestCaseDescriptor withSource(TestNode node) {
        return new TestCaseDescriptor(id, displayName, typeName, node);
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Fully qualified name of the declaring type, or null if the worker did not report one.
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * The bound host node, or null if none was bound or it has been collected.
     */
    public TestNode getSource() {
        return source == null ? null : source.get();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TestCaseDescriptor that)) {
            return false;
        }
        return id.equals(that.id)
                && displayName.equals(that.displayName)
                && Objects.equals(typeName, that.typeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayName, typeName);
    }

    @Override
    public String toString() {
        return id;
    }

}
