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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered group of child nodes: a namespace, a test class, or the assembly itself.
 */
public class TestGroup extends TestNode {

    private final List<TestNode> children = new ArrayList<>();

    public TestGroup(String name) {
        super(name);
    }

    public <T extends TestNode> T add(T child) {
        if (child.getParent() != null) {
            throw new IllegalArgumentException("node already has a parent: " + child.getName());
        }
        child.setParent(this);
        children.add(child);
        return child;
    }

    public List<TestNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public TestGroup findGroup(String name) {
        for (TestNode child : children) {
            if (child instanceof TestGroup group && group.getName().equals(name)) {
                return group;
            }
        }
        return null;
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

}
