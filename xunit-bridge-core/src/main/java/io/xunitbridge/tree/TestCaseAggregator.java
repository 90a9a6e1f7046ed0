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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Flattens a test tree into the ordered list of leaf test cases.
 * <p>
 * Traversal is depth-first pre-order over an explicit stack, so arbitrarily deep
 * trees do not grow the call stack. The tree must be acyclic.
 */
public final class TestCaseAggregator {

    private TestCaseAggregator() {
    }

    public static List<TestCaseDescriptor> flatten(TestNode node) {
        return flatten(node, null);
    }

    /**
     * @param predicate optional, null keeps every leaf
     */
    public static List<TestCaseDescriptor> flatten(TestNode node, Predicate<TestCaseDescriptor> predicate) {
        List<TestCaseDescriptor> testCases = new ArrayList<>();
        walk(node, n -> {
            if (n instanceof TestCaseNode leaf) {
                TestCaseDescriptor descriptor = leaf.getDescriptor();
                if (predicate == null || predicate.test(descriptor)) {
                    testCases.add(descriptor);
                }
            }
        });
        return testCases;
    }

    /**
     * Visit every node under (and including) {@code node}, groups before their children.
     */
    public static void walk(TestNode node, Consumer<TestNode> visitor) {
        Deque<TestNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            TestNode current = stack.pop();
            visitor.accept(current);
            if (current instanceof TestGroup group) {
                List<TestNode> children = group.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
    }

}
