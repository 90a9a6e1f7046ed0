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
package io.xunitbridge.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProcessHandleTest {

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testExitCode() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("sh", "-c", "exit 42")
                .build());
        assertEquals(42, handle.waitSync(5000));
        assertEquals(42, handle.getExitCode());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testLinesArriveBeforeExit() {
        List<String> events = new CopyOnWriteArrayList<>();
        ProcessConfig config = ProcessBuilder.create()
                .args("sh", "-c", "echo one; echo two; echo oops 1>&2")
                .listener(event -> {
                    if (event.isStdout()) {
                        events.add("out:" + event.data());
                    } else if (event.isStderr()) {
                        events.add("err:" + event.data());
                    } else {
                        events.add("exit:" + event.exitCode());
                    }
                })
                .build();
        ProcessHandle handle = ProcessHandle.start(config);
        handle.waitSync(5000);

        assertEquals(4, events.size());
        assertEquals("exit:0", events.get(3));
        assertTrue(events.indexOf("out:one") < events.indexOf("out:two"));
        assertTrue(events.contains("err:oops"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testEventThread() {
        List<Boolean> onEventThread = new CopyOnWriteArrayList<>();
        ProcessHandle handle = ProcessHandle.create(ProcessBuilder.create()
                .args("sh", "-c", "echo hi")
                .build());
        handle.onEvent(event -> onEventThread.add(handle.isEventThread()));
        handle.start();
        handle.waitSync(5000);

        assertEquals(List.of(true, true), onEventThread);
        assertFalse(handle.isEventThread());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testSendLine() {
        List<String> lines = new CopyOnWriteArrayList<>();
        ProcessHandle handle = ProcessHandle.create(ProcessBuilder.create()
                        .args("sh", "-c", "read line; echo \"got $line\"")
                        .build())
                .onEvent(event -> {
                    if (event.isStdout()) {
                        lines.add(event.data());
                    }
                });
        handle.start();
        assertDoesNotThrow(() -> handle.send("hello"));
        assertEquals(0, handle.waitSync(5000));
        assertEquals(List.of("got hello"), lines);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testEnvironmentAndWorkingDir() {
        List<String> lines = new CopyOnWriteArrayList<>();
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .line("sh -c 'echo $MY_VAR; pwd'")
                .env("MY_VAR", "hello_world")
                .workingDir("/")
                .listener(event -> {
                    if (event.isStdout()) {
                        lines.add(event.data());
                    }
                })
                .build());
        handle.waitSync(5000);
        assertEquals(List.of("hello_world", "/"), lines);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testCloseStopsProcess() throws Exception {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("sleep", "30")
                .build());
        assertTrue(handle.isAlive());
        handle.close(true);
        handle.close(true);
        assertTrue(handle.isClosed());
        handle.getExitFuture().get(5, TimeUnit.SECONDS);
        assertFalse(handle.isAlive());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testStartTwice() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create().args("true").build());
        assertThrows(IllegalStateException.class, handle::start);
        handle.waitSync(5000);
    }

    @Test
    void testStartFailure() {
        ProcessHandle handle = ProcessHandle.create(ProcessBuilder.create()
                .args("no-such-command-xunit-bridge")
                .build());
        assertThrows(ProcessStartException.class, handle::start);
    }

}
