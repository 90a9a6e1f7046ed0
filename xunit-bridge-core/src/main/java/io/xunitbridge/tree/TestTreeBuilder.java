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

import java.util.List;

/**
 * Builds a host test tree from discovered test cases.
 * <p>
 * Each dotted segment of the declaring type name becomes a group, e.g.
 * {@code Acme.Math.AdderTests.AddsTwo} ends up under {@code Acme > Math > AdderTests}.
 * Leaves keep discovery order.
 */
public final class TestTreeBuilder {

    private TestTreeBuilder() {
    }

    public static AssemblySuite build(String assemblyPath, List<TestCaseDescriptor> testCases) {
        AssemblySuite root = new AssemblySuite(assemblyPath);
        for (TestCaseDescriptor testCase : testCases) {
            String typeName = typeNameOf(testCase);
            TestGroup parent = root;
            if (typeName != null) {
                for (String segment : typeName.split("\\.")) {
                    if (segment.isEmpty()) {
                        continue;
                    }
                    TestGroup group = parent.findGroup(segment);
                    parent = group != null ? group : parent.add(new TestGroup(segment));
                }
            }
            parent.add(new TestCaseNode(leafName(testCase.getDisplayName(), typeName), testCase));
        }
        return root;
    }

    static String typeNameOf(TestCaseDescriptor testCase) {
        if (testCase.getTypeName() != null && !testCase.getTypeName().isEmpty()) {
            return testCase.getTypeName();
        }
        String id = testCase.getId();
        int pos = id.lastIndexOf('.');
        return pos > 0 ? id.substring(0, pos) : null;
    }

    static String leafName(String displayName, String typeName) {
        if (typeName != null && displayName.startsWith(typeName + ".")) {
            return displayName.substring(typeName.length() + 1);
        }
        return displayName;
    }

}
