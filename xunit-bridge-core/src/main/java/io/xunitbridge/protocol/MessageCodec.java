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

import io.xunitbridge.common.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON Lines codec for the worker channel.
 * <p>
 * Every line is an envelope:
 * <pre>
 * {"command":"testStarted","payload":{"id":"MyTests.Adds"}}
 * {"command":"testPassed","payload":{"id":"MyTests.Adds","durationMillis":12}}
 * {"command":"runFinished","payload":{}}
 * </pre>
 * Lines that are not envelopes are plain worker console output, {@link #decode(String)}
 * returns null for them.
 */
public final class MessageCodec {

    private static final Logger logger = LoggerFactory.getLogger(MessageCodec.class);

    // worker -> host
    public static final String READY = "ready";
    public static final String TEST_CASE_DISCOVERED = "testCaseDiscovered";
    public static final String DISCOVERY_COMPLETE = "discoveryComplete";
    public static final String TEST_STARTED = "testStarted";
    public static final String TEST_PASSED = "testPassed";
    public static final String TEST_FAILED = "testFailed";
    public static final String TEST_SKIPPED = "testSkipped";
    public static final String RUN_FINISHED = "runFinished";
    public static final String ERROR = "error";

    // host -> worker
    public static final String DISCOVER = "discover";
    public static final String RUN = "run";
    public static final String EXIT = "exit";

    private MessageCodec() {
    }

    // ========== Host requests ==========

    public static String encodeDiscover(DiscoveryRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("assemblyPath", request.assemblyPath());
        if (request.configPath() != null) {
            payload.put("configPath", request.configPath());
        }
        payload.put("supportAssemblies", new ArrayList<>(request.supportAssemblies()));
        return envelope(DISCOVER, payload);
    }

    public static String encodeRun(RunRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("assemblyPath", request.assemblyPath());
        if (request.configPath() != null) {
            payload.put("configPath", request.configPath());
        }
        if (!request.filter().isAll()) {
            payload.put("filter", new ArrayList<>(request.filter().getIds()));
        }
        payload.put("supportAssemblies", new ArrayList<>(request.supportAssemblies()));
        if (request.crashLogPath() != null) {
            payload.put("crashLogPath", request.crashLogPath().toString());
        }
        return envelope(RUN, payload);
    }

    public static String encodeExit() {
        return envelope(EXIT, new LinkedHashMap<>());
    }

    // ========== Worker messages ==========

    public static String encode(WorkerMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        String command;
        if (message instanceof WorkerMessage.Ready m) {
            command = READY;
            payload.put("runtimeVersion", m.runtimeVersion());
        } else if (message instanceof WorkerMessage.Error m) {
            command = ERROR;
            payload.put("message", m.message());
            payload.put("code", m.code());
        } else if (message instanceof DiscoveryMessage.TestCaseDiscovered m) {
            command = TEST_CASE_DISCOVERED;
            TestCaseDescriptor tc = m.testCase();
            payload.put("id", tc.getId());
            payload.put("displayName", tc.getDisplayName());
            if (tc.getTypeName() != null) {
                payload.put("typeName", tc.getTypeName());
            }
        } else if (message instanceof DiscoveryMessage.DiscoveryComplete) {
            command = DISCOVERY_COMPLETE;
        } else if (message instanceof ResultEvent.TestStarted m) {
            command = TEST_STARTED;
            payload.put("id", m.id());
        } else if (message instanceof ResultEvent.TestPassed m) {
            command = TEST_PASSED;
            payload.put("id", m.id());
            payload.put("durationMillis", m.duration() == null ? 0 : m.duration().toMillis());
        } else if (message instanceof ResultEvent.TestFailed m) {
            command = TEST_FAILED;
            payload.put("id", m.id());
            payload.put("message", m.message());
            if (m.stackTrace() != null) {
                payload.put("stackTrace", m.stackTrace());
            }
        } else if (message instanceof ResultEvent.TestSkipped m) {
            command = TEST_SKIPPED;
            payload.put("id", m.id());
            payload.put("reason", m.reason());
        } else {
            command = RUN_FINISHED;
        }
        return envelope(command, payload);
    }

    /**
     * Decode one line written by the worker.
     *
     * @return the message, or null if the line is console output or an unknown command
     * @throws IllegalArgumentException if a known command is missing a required field
     */
    public static WorkerMessage decode(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        Object parsed;
        try {
            parsed = Json.parseStrict(trimmed);
        } catch (RuntimeException e) {
            return null;
        }
        if (!(parsed instanceof Map<?, ?> map) || !(map.get("command") instanceof String command)) {
            return null;
        }
        Map<?, ?> payload = map.get("payload") instanceof Map<?, ?> p ? p : Map.of();
        return switch (command) {
            case READY -> new WorkerMessage.Ready(optional(payload, "runtimeVersion"));
            case ERROR -> new WorkerMessage.Error(optional(payload, "message"), optional(payload, "code"));
            case TEST_CASE_DISCOVERED -> new DiscoveryMessage.TestCaseDiscovered(new TestCaseDescriptor(
                    required(payload, "id", command),
                    optional(payload, "displayName"),
                    optional(payload, "typeName")));
            case DISCOVERY_COMPLETE -> new DiscoveryMessage.DiscoveryComplete();
            case TEST_STARTED -> new ResultEvent.TestStarted(required(payload, "id", command));
            case TEST_PASSED -> new ResultEvent.TestPassed(required(payload, "id", command), duration(payload));
            case TEST_FAILED -> new ResultEvent.TestFailed(required(payload, "id", command),
                    optional(payload, "message"), optional(payload, "stackTrace"));
            case TEST_SKIPPED -> new ResultEvent.TestSkipped(required(payload, "id", command), optional(payload, "reason"));
            case RUN_FINISHED -> new ResultEvent.RunFinished();
            default -> {
                logger.warn("ignoring unknown worker command: {}", command);
                yield null;
            }
        };
    }

    private static String envelope(String command, Map<String, Object> payload) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("command", command);
        map.put("payload", payload);
        return Json.stringifyStrict(map);
    }

    private static String required(Map<?, ?> payload, String key, String command) {
        String value = optional(payload, key);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("'" + command + "' message is missing '" + key + "'");
        }
        return value;
    }

    private static String optional(Map<?, ?> payload, String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    private static Duration duration(Map<?, ?> payload) {
        Object value = payload.get("durationMillis");
        if (value instanceof Number n) {
            return Duration.ofMillis(n.longValue());
        }
        return Duration.ZERO;
    }

}
