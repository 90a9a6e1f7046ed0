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
package io.xunitbridge.client;

import io.xunitbridge.process.ProcessBuilder;
import io.xunitbridge.process.ProcessConfig;
import io.xunitbridge.protocol.RuntimeVersion;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Launches the worker from a fixed command line. The requested runtime version is
 * passed in the {@value #RUNTIME_ENV} environment variable.
 */
public class CommandExecutionHandler implements ExecutionHandler {

    public static final String RUNTIME_ENV = "XUNIT_BRIDGE_RUNTIME";

    private final List<String> command;
    private final Path workingDir;
    private final Map<String, String> env;

    public CommandExecutionHandler(List<String> command, Path workingDir, Map<String, String> env) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDir = workingDir;
        this.env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static CommandExecutionHandler of(String commandLine) {
        return new CommandExecutionHandler(ProcessBuilder.tokenize(commandLine), null, null);
    }

    @Override
    public ProcessConfig prepare(RuntimeVersion version) {
        return ProcessBuilder.create()
                .args(command)
                .workingDir(workingDir)
                .env(env)
                .env(RUNTIME_ENV, version.getWireName())
                .build();
    }

    public List<String> getCommand() {
        return command;
    }

}
