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
package io.xunitbridge.cli;

import io.xunitbridge.tree.AssemblySuite;
import io.xunitbridge.tree.TestCaseAggregator;
import io.xunitbridge.tree.TestCaseNode;
import io.xunitbridge.tree.TestGroup;
import io.xunitbridge.tree.TestNode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * The 'discover' subcommand: lists the test cases of an assembly as a tree.
 * <p>
 * Usage examples:
 * <pre>
 * xunit-bridge discover bin/Debug/Acme.Tests.dll
 * xunit-bridge discover --worker "dotnet worker.dll" Acme.Tests.dll
 * </pre>
 */
@Command(
        name = "discover",
        mixinStandardHelpOptions = true,
        description = "List the test cases of a test assembly"
)
public class DiscoverCommand implements Callable<Integer> {

    @Parameters(
            index = "0",
            description = "Test assembly to discover"
    )
    String assemblyPath;

    @Mixin
    BridgeOptions options;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            AssemblySuite suite = options.discover(assemblyPath);
            print(out, suite, 0);
            int count = TestCaseAggregator.flatten(suite).size();
            out.println(count + " test case(s)");
            out.flush();
            return 0;
        } catch (Exception e) {
            return Main.printError(spec, e);
        }
    }

    static void print(PrintWriter out, TestNode node, int depth) {
        out.print("  ".repeat(depth));
        if (node instanceof TestCaseNode testCase) {
            out.println(node.getName() + " [" + testCase.getId() + "]");
        } else {
            out.println(node.getName());
        }
        if (node instanceof TestGroup group) {
            for (TestNode child : group.getChildren()) {
                print(out, child, depth + 1);
            }
        }
    }

}
