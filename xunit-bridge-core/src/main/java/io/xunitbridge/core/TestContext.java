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

import io.xunitbridge.client.ExecutionHandler;

import java.util.function.Consumer;

/**
 * Everything the host supplies for a run: how to launch the worker, the
 * cancellation token, where results and console output go.
 * <p>
 * Example usage:
 * <pre>
 * TestContext context = TestContext.builder(config)
 *     .token(source.getToken())
 *     .resultListener(treeView)
 *     .console(System.out::println)
 *     .build();
 * </pre>
 */
public class TestContext {

    private final BridgeConfig config;
    private final ExecutionHandler executionHandler;
    private final CancellationToken token;
    private final ResultListener resultListener;
    private final Consumer<String> console;
    private final RunnerClientFactory clientFactory;
    private final boolean reportToMonitor;

    private TestContext(Builder builder) {
        this.config = builder.config;
        this.executionHandler = builder.executionHandler != null
                ? builder.executionHandler : builder.config.toExecutionHandler();
        this.token = builder.token;
        this.resultListener = builder.resultListener;
        this.console = builder.console;
        this.clientFactory = builder.clientFactory;
        this.reportToMonitor = builder.reportToMonitor;
    }

    public static Builder builder(BridgeConfig config) {
        return new Builder(config);
    }

    public BridgeConfig getConfig() {
        return config;
    }

    public ExecutionHandler getExecutionHandler() {
        return executionHandler;
    }

    public CancellationToken getToken() {
        return token;
    }

    public ResultListener getResultListener() {
        return resultListener;
    }

    /**
     * Host consumer of worker console lines, null if the host does not want them.
     */
    public Consumer<String> getConsole() {
        return console;
    }

    public RunnerClientFactory getClientFactory() {
        return clientFactory;
    }

    public boolean isReportToMonitor() {
        return reportToMonitor;
    }

    public static class Builder {

        private final BridgeConfig config;
        private ExecutionHandler executionHandler;
        private CancellationToken token = CancellationToken.NONE;
        private ResultListener resultListener = ResultListener.NONE;
        private Consumer<String> console;
        private RunnerClientFactory clientFactory = RunnerClientFactory.process();
        private boolean reportToMonitor = true;

        Builder(BridgeConfig config) {
            this.config = config != null ? config : new BridgeConfig();
        }

        /**
         * Overrides the worker command of the configuration.
         */
        public Builder executionHandler(ExecutionHandler executionHandler) {
            this.executionHandler = executionHandler;
            return this;
        }

        public Builder token(CancellationToken token) {
            this.token = token != null ? token : CancellationToken.NONE;
            return this;
        }

        public Builder resultListener(ResultListener resultListener) {
            this.resultListener = resultListener != null ? resultListener : ResultListener.NONE;
            return this;
        }

        public Builder console(Consumer<String> console) {
            this.console = console;
            return this;
        }

        public Builder clientFactory(RunnerClientFactory clientFactory) {
            this.clientFactory = clientFactory;
            return this;
        }

        /**
         * When false, node status changes are applied to the tree but not
         * forwarded to the result listener.
         */
        public Builder reportToMonitor(boolean reportToMonitor) {
            this.reportToMonitor = reportToMonitor;
            return this;
        }

        public TestContext build() {
            return new TestContext(this);
        }

    }

}
