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
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    @Test
    void testDecodeReady() {
        WorkerMessage message = MessageCodec.decode("{\"command\":\"ready\",\"payload\":{\"runtimeVersion\":\"xunit2\"}}");
        assertEquals(new WorkerMessage.Ready("xunit2"), message);
    }

    @Test
    void testDecodeDiscovered() {
        WorkerMessage message = MessageCodec.decode(
                "{\"command\":\"testCaseDiscovered\",\"payload\":{\"id\":\"t1\",\"displayName\":\"Acme.MathTests.Adds\",\"typeName\":\"Acme.MathTests\"}}");
        DiscoveryMessage.TestCaseDiscovered discovered = assertInstanceOf(DiscoveryMessage.TestCaseDiscovered.class, message);
        assertEquals("t1", discovered.testCase().getId());
        assertEquals("Acme.MathTests.Adds", discovered.testCase().getDisplayName());
        assertEquals("Acme.MathTests", discovered.testCase().getTypeName());
    }

    @Test
    void testDecodeDisplayNameDefaultsToId() {
        WorkerMessage message = MessageCodec.decode("{\"command\":\"testCaseDiscovered\",\"payload\":{\"id\":\"t1\"}}");
        DiscoveryMessage.TestCaseDiscovered discovered = assertInstanceOf(DiscoveryMessage.TestCaseDiscovered.class, message);
        assertEquals("t1", discovered.testCase().getDisplayName());
        assertNull(discovered.testCase().getTypeName());
    }

    @Test
    void testDecodeResultEvents() {
        assertEquals(new ResultEvent.TestStarted("t1"),
                MessageCodec.decode("{\"command\":\"testStarted\",\"payload\":{\"id\":\"t1\"}}"));
        assertEquals(new ResultEvent.TestPassed("t1", Duration.ofMillis(12)),
                MessageCodec.decode("{\"command\":\"testPassed\",\"payload\":{\"id\":\"t1\",\"durationMillis\":12}}"));
        assertEquals(new ResultEvent.TestFailed("t1", "expected 3", "at Adds()"),
                MessageCodec.decode("{\"command\":\"testFailed\",\"payload\":{\"id\":\"t1\",\"message\":\"expected 3\",\"stackTrace\":\"at Adds()\"}}"));
        assertEquals(new ResultEvent.TestSkipped("t1", "flaky"),
                MessageCodec.decode("{\"command\":\"testSkipped\",\"payload\":{\"id\":\"t1\",\"reason\":\"flaky\"}}"));
        assertEquals(new ResultEvent.RunFinished(),
                MessageCodec.decode("{\"command\":\"runFinished\",\"payload\":{}}"));
        assertEquals(new DiscoveryMessage.DiscoveryComplete(),
                MessageCodec.decode("{\"command\":\"discoveryComplete\"}"));
    }

    @Test
    void testDecodePassedWithoutDuration() {
        ResultEvent.TestPassed passed = assertInstanceOf(ResultEvent.TestPassed.class,
                MessageCodec.decode("{\"command\":\"testPassed\",\"payload\":{\"id\":\"t1\"}}"));
        assertEquals(Duration.ZERO, passed.duration());
    }

    @Test
    void testDecodeError() {
        WorkerMessage message = MessageCodec.decode("{\"command\":\"error\",\"payload\":{\"message\":\"cannot load assembly\",\"code\":\"E_LOAD\"}}");
        assertEquals(new WorkerMessage.Error("cannot load assembly", "E_LOAD"), message);
    }

    @Test
    void testConsoleOutputIsNotAMessage() {
        assertNull(MessageCodec.decode("Starting test execution..."));
        assertNull(MessageCodec.decode(""));
        assertNull(MessageCodec.decode(null));
        assertNull(MessageCodec.decode("{ not json"));
        assertNull(MessageCodec.decode("{\"foo\":1}"));
        assertNull(MessageCodec.decode("{\"command\":42}"));
    }

    @Test
    void testUnknownCommandIsIgnored() {
        assertNull(MessageCodec.decode("{\"command\":\"telemetry\",\"payload\":{}}"));
    }

    @Test
    void testMissingIdIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> MessageCodec.decode("{\"command\":\"testStarted\",\"payload\":{}}"));
        assertTrue(e.getMessage().contains("testStarted"));
        assertThrows(IllegalArgumentException.class,
                () -> MessageCodec.decode("{\"command\":\"testPassed\",\"payload\":{\"id\":\"\"}}"));
    }

    @Test
    void testEncodeRunWithFilter() {
        RunRequest request = new RunRequest("Acme.Tests.dll", "xunit.runner.json",
                NameFilter.of("t1", "t3"), List.of("Shared.dll"), Path.of("crash.log"));
        Json json = Json.of(MessageCodec.encodeRun(request));
        assertEquals("run", json.get("command"));
        assertEquals("Acme.Tests.dll", json.get("payload.assemblyPath"));
        assertEquals("xunit.runner.json", json.get("payload.configPath").isEmpty());
        assertEquals(List.of("t1", "t3"), json.get("payload.filter").isEmpty());
        assertEquals(List.of("Shared.dll"), json.get("payload.supportAssemblies"));
        assertEquals("crash.log", json.get("payload.crashLogPath").isEmpty());
    }

    @Test
    void testEncodeRunAllOmitsFilter() {
        RunRequest request = new RunRequest("Acme.Tests.dll", null, NameFilter.all(), null, null);
        Json json = Json.of(MessageCodec.encodeRun(request));
        assertTrue(json.getOptional("payload.filter").isEmpty());
        assertTrue(json.getOptional("payload.configPath").isEmpty());
        assertTrue(json.getOptional("payload.crashLogPath").isEmpty());
        assertEquals(List.of(), json.get("payload.supportAssemblies"));
    }

    @Test
    void testEncodeDiscoverAndExit() {
        Json discover = Json.of(MessageCodec.encodeDiscover(DiscoveryRequest.of("Acme.Tests.dll")));
        assertEquals("discover", discover.get("command"));
        assertEquals("Acme.Tests.dll", discover.get("payload.assemblyPath"));
        assertEquals("{\"command\":\"exit\",\"payload\":{}}", MessageCodec.encodeExit());
    }

    @Test
    void testWorkerMessagesDecodeAsEncoded() {
        List<WorkerMessage> messages = List.of(
                new WorkerMessage.Ready("xunit1"),
                new DiscoveryMessage.TestCaseDiscovered(new TestCaseDescriptor("t1", "Adds", "Acme.MathTests")),
                new ResultEvent.TestFailed("t1", "line one\nline two", "at \"quoted\""),
                new ResultEvent.RunFinished());
        for (WorkerMessage message : messages) {
            assertEquals(message, MessageCodec.decode(MessageCodec.encode(message)));
        }
    }

    @Test
    void testEncodedEnvelopeShape() {
        Map<String, Object> map = Json.of(MessageCodec.encode(new ResultEvent.TestStarted("t1"))).asMap();
        assertEquals(List.of("command", "payload"), List.copyOf(map.keySet()));
    }

}
