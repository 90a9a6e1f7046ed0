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

import io.xunitbridge.common.Json;
import io.xunitbridge.core.UnitTestResult;
import io.xunitbridge.protocol.NameFilter;
import io.xunitbridge.protocol.TestCaseDescriptor;
import io.xunitbridge.tree.AssemblySuite;
import io.xunitbridge.tree.TestTreeBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    static final String WORKER = """
            printf '{"command":"ready","payload":{"runtimeVersion":"%s"}}\\n' "$XUNIT_BRIDGE_RUNTIME"
            while read line; do
              case "$line" in
                *'"command":"discover"'*)
                  echo '{"command":"testCaseDiscovered","payload":{"id":"Acme.MathTests.Adds","displayName":"Acme.MathTests.Adds","typeName":"Acme.MathTests"}}'
                  echo '{"command":"testCaseDiscovered","payload":{"id":"Acme.MathTests.Divides","displayName":"Acme.MathTests.Divides","typeName":"Acme.MathTests"}}'
                  echo '{"command":"discoveryComplete","payload":{}}'
                  ;;
                *'"command":"run"'*)
                  echo '{"command":"testStarted","payload":{"id":"Acme.MathTests.Adds"}}'
                  echo '{"command":"testPassed","payload":{"id":"Acme.MathTests.Adds","durationMillis":2}}'
                  case "$line" in
                    *Divides*)
                      echo '{"command":"testStarted","payload":{"id":"Acme.MathTests.Divides"}}'
                      echo '{"command":"testFailed","payload":{"id":"Acme.MathTests.Divides","message":"divide by zero"}}'
                      ;;
                  esac
                  echo '{"command":"runFinished","payload":{}}'
                  ;;
                *'"command":"exit"'*)
                  exit 0
                  ;;
              esac
            done
            """;

    @TempDir
    Path tempDir;

    final StringWriter out = new StringWriter();
    final StringWriter err = new StringWriter();

    int execute(String... args) {
        CommandLine cl = new CommandLine(new Main());
        cl.setOut(new PrintWriter(out));
        cl.setErr(new PrintWriter(err));
        return cl.execute(args);
    }

    String worker() throws Exception {
        Path script = tempDir.resolve("worker.sh");
        Files.writeString(script, WORKER);
        return "sh " + script;
    }

    String config() {
        return tempDir.resolve("none.json").toString();
    }

    @Test
    void testVersion() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().startsWith("xunit-bridge "));
    }

    @Test
    void testNoSubcommandShowsUsage() {
        assertEquals(0, execute());
        assertTrue(out.toString().contains("discover"));
        assertTrue(out.toString().contains("run"));
    }

    @Test
    void testSelection() {
        AssemblySuite suite = TestTreeBuilder.build("a.dll", List.of(
                new TestCaseDescriptor("1", "Acme.A.Adds", "Acme.A"),
                new TestCaseDescriptor("2", "Acme.A.Divides", "Acme.A"),
                new TestCaseDescriptor("3", "Acme.B.Adds", "Acme.B")));
        CommandLine cl = new CommandLine(new Main());

        RunCommand all = (RunCommand) cl.parseArgs("run", "a.dll").subcommand().commandSpec().userObject();
        assertEquals(NameFilter.all(), all.selection(suite));

        cl = new CommandLine(new Main());
        RunCommand byName = (RunCommand) cl.parseArgs("run", "-n", ".*Adds", "a.dll").subcommand().commandSpec().userObject();
        assertEquals(NameFilter.of("1", "3"), byName.selection(suite));

        cl = new CommandLine(new Main());
        RunCommand both = (RunCommand) cl.parseArgs("run", "-n", ".*Adds", "-f", "3", "-f", "2", "a.dll")
                .subcommand().commandSpec().userObject();
        assertEquals(NameFilter.of("3"), both.selection(suite));

        cl = new CommandLine(new Main());
        RunCommand none = (RunCommand) cl.parseArgs("run", "-f", "9", "a.dll").subcommand().commandSpec().userObject();
        assertNull(none.selection(suite));
    }

    @Test
    void testSummaryOfCanceledRun() {
        StringWriter sw = new StringWriter();
        RunCommand.printSummary(new PrintWriter(sw), UnitTestResult.createCanceled("Canceled"));
        assertEquals("Canceled", sw.toString().trim());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testDiscover() throws Exception {
        assertEquals(0, execute("discover", "-c", config(), "--worker", worker(), "Acme.Tests.dll"));
        String output = out.toString();
        assertTrue(output.contains("Acme.Tests.dll"));
        assertTrue(output.contains("    MathTests"));
        assertTrue(output.contains("Adds [Acme.MathTests.Adds]"));
        assertTrue(output.contains("2 test case(s)"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testRunPassing() throws Exception {
        int exitCode = execute("run", "-c", config(), "--worker", worker(), "-f", "Acme.MathTests.Adds", "Acme.Tests.dll");
        assertEquals(RunCommand.EXIT_PASSED, exitCode, err.toString());
        assertTrue(out.toString().contains("Total: 1, passed: 1, failed: 0, skipped: 0"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testRunFailing() throws Exception {
        int exitCode = execute("run", "-c", config(), "--worker", worker(), "Acme.Tests.dll");
        assertEquals(RunCommand.EXIT_FAILED, exitCode, err.toString());
        String output = out.toString();
        assertTrue(output.contains("FAILED Acme.MathTests.Divides"));
        assertTrue(output.contains("divide by zero"));
        assertTrue(output.contains("Total: 2, passed: 1, failed: 1, skipped: 0"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testRunJson() throws Exception {
        int exitCode = execute("run", "--json", "-c", config(), "--worker", worker(), "Acme.Tests.dll");
        assertEquals(RunCommand.EXIT_FAILED, exitCode, err.toString());
        Json json = Json.of(out.toString().trim());
        assertEquals(1, (Integer) json.get("passed"));
        assertEquals(1, (Integer) json.get("failed"));
        assertEquals(false, json.get("canceled"));
        assertEquals("divide by zero", json.get("failures[0].message"));
    }

    @Test
    void testWorkerCannotStart() {
        int exitCode = execute("discover", "-c", config(), "--worker", "no-such-worker-xunit-bridge", "a.dll");
        assertEquals(Main.EXIT_ERROR, exitCode);
        assertTrue(err.toString().startsWith("Error: "));
    }

}
