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

import io.xunitbridge.client.CommandExecutionHandler;
import io.xunitbridge.client.ExecutionHandler;
import io.xunitbridge.common.Json;
import io.xunitbridge.process.ProcessBuilder;
import io.xunitbridge.protocol.RuntimeVersion;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bridge settings loaded from xunit-bridge.json.
 * <p>
 * Example xunit-bridge.json:
 * <pre>
 * {
 *   "worker": {
 *     "command": "dotnet xunit-worker.dll",
 *     "workingDir": "/home/user/project",
 *     "env": { "DOTNET_CLI_TELEMETRY_OPTOUT": "1" }
 *   },
 *   "runtimeVersion": "xunit2",
 *   "connectTimeoutMillis": 30000,
 *   "crashLogDir": "target/crash-logs",
 *   "supportAssemblies": ["lib/Shared.dll"],
 *   "configPath": "xunit.runner.json"
 * }
 * </pre>
 */
public class BridgeConfig {

    public static final String DEFAULT_FILE = "xunit-bridge.json";
    public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 30000;

    private List<String> workerCommand = new ArrayList<>();
    private String workerWorkingDir;
    private Map<String, String> workerEnv = new LinkedHashMap<>();
    private RuntimeVersion runtimeVersion = RuntimeVersion.XUNIT2;
    private long connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;
    private String crashLogDir;
    private List<String> supportAssemblies = new ArrayList<>();
    private String configPath;

    /**
     * Load from a file, or return the defaults if the file does not exist.
     *
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static BridgeConfig load(Path path) {
        if (!Files.exists(path)) {
            return new BridgeConfig();
        }
        try {
            return parse(Files.readString(path));
        } catch (Exception e) {
            throw new RuntimeException("Failed to load config from: " + path, e);
        }
    }

    public static BridgeConfig parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("Invalid config: expected JSON object");
        }
        BridgeConfig config = new BridgeConfig();

        // worker.command may be a command line or an argument list
        j.getOptional("worker.command").ifPresent(command -> {
            if (command instanceof List<?> list) {
                List<String> args = new ArrayList<>(list.size());
                list.forEach(arg -> args.add(String.valueOf(arg)));
                config.setWorkerCommand(args);
            } else {
                config.setWorkerCommand(ProcessBuilder.tokenize(command.toString()));
            }
        });
        j.<String>getOptional("worker.workingDir").ifPresent(config::setWorkerWorkingDir);
        j.<Map<String, Object>>getOptional("worker.env").ifPresent(env -> {
            Map<String, String> map = new LinkedHashMap<>();
            env.forEach((k, v) -> map.put(k, v == null ? "" : v.toString()));
            config.setWorkerEnv(map);
        });

        j.<String>getOptional("runtimeVersion").ifPresent(v -> config.setRuntimeVersion(RuntimeVersion.fromWireName(v)));
        j.<Number>getOptional("connectTimeoutMillis").ifPresent(n -> config.setConnectTimeoutMillis(n.longValue()));
        j.<String>getOptional("crashLogDir").ifPresent(config::setCrashLogDir);
        j.<List<String>>getOptional("supportAssemblies").ifPresent(config::setSupportAssemblies);
        j.<String>getOptional("configPath").ifPresent(config::setConfigPath);

        return config;
    }

    /**
     * @throws IllegalStateException if no worker command is configured
     */
    public ExecutionHandler toExecutionHandler() {
        if (workerCommand.isEmpty()) {
            throw new IllegalStateException("no worker command configured, set worker.command in " + DEFAULT_FILE);
        }
        Path dir = workerWorkingDir == null ? null : Path.of(workerWorkingDir);
        return new CommandExecutionHandler(workerCommand, dir, workerEnv);
    }

    public Path resolveCrashLogDir() {
        return crashLogDir == null ? Path.of(System.getProperty("java.io.tmpdir")) : Path.of(crashLogDir);
    }

    // ========== Getters and Setters ==========

    public List<String> getWorkerCommand() {
        return workerCommand;
    }

    public void setWorkerCommand(List<String> workerCommand) {
        this.workerCommand = workerCommand != null ? new ArrayList<>(workerCommand) : new ArrayList<>();
    }

    public String getWorkerWorkingDir() {
        return workerWorkingDir;
    }

    public void setWorkerWorkingDir(String workerWorkingDir) {
        this.workerWorkingDir = workerWorkingDir;
    }

    public Map<String, String> getWorkerEnv() {
        return workerEnv;
    }

    public void setWorkerEnv(Map<String, String> workerEnv) {
        this.workerEnv = workerEnv != null ? new LinkedHashMap<>(workerEnv) : new LinkedHashMap<>();
    }

    public RuntimeVersion getRuntimeVersion() {
        return runtimeVersion;
    }

    public void setRuntimeVersion(RuntimeVersion runtimeVersion) {
        this.runtimeVersion = runtimeVersion;
    }

    public long getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public Duration getConnectTimeout() {
        return Duration.ofMillis(connectTimeoutMillis);
    }

    public void setConnectTimeoutMillis(long connectTimeoutMillis) {
        if (connectTimeoutMillis <= 0) {
            throw new IllegalArgumentException("connectTimeoutMillis must be positive: " + connectTimeoutMillis);
        }
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public String getCrashLogDir() {
        return crashLogDir;
    }

    public void setCrashLogDir(String crashLogDir) {
        this.crashLogDir = crashLogDir;
    }

    public List<String> getSupportAssemblies() {
        return supportAssemblies;
    }

    public void setSupportAssemblies(List<String> supportAssemblies) {
        this.supportAssemblies = supportAssemblies != null ? new ArrayList<>(supportAssemblies) : new ArrayList<>();
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

}
