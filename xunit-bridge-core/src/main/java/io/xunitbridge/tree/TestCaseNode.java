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

import io.xunitbridge.protocol.TestCaseDescriptor;

public class TestCaseNode extends TestNode {

    private final TestCaseDescriptor descriptor;

    public TestCaseNode(String id, String displayName, String typeName) {
        super(displayName == null ? id : displayName);
        this.descriptor = new TestCaseDescriptor(id, displayName, typeName, this);
    }

    public TestCaseNode(TestCaseDescriptor discovered) {
        this(discovered.getDisplayName(), discovered);
    }

    public TestCaseNode(String name, TestCaseDescriptor discovered) {
        super(name);
        this.descriptor = discovered.withSource(this);
    }

    public String getId() {
        return descriptor.getId();
    }

    public TestCaseDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

}
