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

import io.xunitbridge.client.CommandExecutionHandler;
import io.xunitbridge.client.ExecutionHandler;
import io.xunitbridge.client.ProcessRunnerClient;
import io.xunitbridge.core.BridgeConfig;
import io.xunitbridge.core.TestConsole;
import io.xunitbridge.protocol.DiscoveryRequest;
import io.xunitbridge.protocol.TestCaseDescriptor;
import io.xunitbridge.tree.AssemblySuite;
import io.xunitbridge.tree.TestTreeBuilder;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * Options shared by the subcommands that talk to a worker.
 */
public class BridgeOptions {

    @Option(
            names = {"-c", "--config"},
            description = "Path to the bridge config file (default: xunit-bridge.json)"
    )
    String configFile;

    @Option(
            names = {"--worker"},
            description = "Worker command line, overrides worker.command of the config file"
    )
    String workerCommand;

    private BridgeConfig config;

    BridgeConfig config() {
        if (config == null) {
            config = BridgeConfig.load(Path.of(configFile != null ? configFile : BridgeConfig.DEFAULT_FILE));
        }
        return config;
    }

    ExecutionHandler executionHandler() {
        if (workerCommand != null) {
            return CommandExecutionHandler.of(workerCommand);
        }
        return config().toExecutionHandler();
    }

    /**
     * Ask a short-lived worker what the assembly contains and build the tree from it.
     */
    AssemblySuite discover(String assemblyPath) {
        BridgeConfig cfg = config();
        DiscoveryRequest request = new DiscoveryRequest(assemblyPath, cfg.getConfigPath(), cfg.getSupportAssemblies());
        List<TestCaseDescriptor> testCases;
        try (TestConsole console = new TestConsole(null);
             ProcessRunnerClient client = new ProcessRunnerClient(cfg.getConnectTimeout(), console::println)) {
            client.connect(cfg.getRuntimeVersion(), executionHandler()).join();
            testCases = client.discover(request, null).join();
        }
        AssemblySuite suite = TestTreeBuilder.build(assemblyPath, testCases);
        suite.setConfigPath(cfg.getConfigPath());
        suite.setSupportAssemblies(cfg.getSupportAssemblies());
        return suite;
    }

}
