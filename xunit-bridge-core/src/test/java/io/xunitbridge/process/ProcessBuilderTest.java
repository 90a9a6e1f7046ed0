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

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessBuilderTest {

    @Test
    void testTokenizeSimple() {
        assertEquals(List.of("dotnet", "worker.dll", "--verbose"), ProcessBuilder.tokenize("dotnet  worker.dll --verbose"));
    }

    @Test
    void testTokenizeQuotes() {
        assertEquals(List.of("sh", "-c", "echo $HOME"), ProcessBuilder.tokenize("sh -c 'echo $HOME'"));
        assertEquals(List.of("a b", "c\"d"), ProcessBuilder.tokenize("\"a b\" \"c\\\"d\""));
        assertEquals(List.of("prefix-quoted"), ProcessBuilder.tokenize("prefix-'quoted'"));
        assertEquals(List.of("x", "", "y"), ProcessBuilder.tokenize("x '' y"));
    }

    @Test
    void testTokenizeEscapes() {
        assertEquals(List.of("a b"), ProcessBuilder.tokenize("a\\ b"));
    }

    @Test
    void testTokenizeUnterminatedQuote() {
        assertThrows(IllegalArgumentException.class, () -> ProcessBuilder.tokenize("echo 'oops"));
    }

    @Test
    void testBuild() {
        ProcessConfig config = ProcessBuilder.create()
                .line("dotnet worker.dll")
                .arg("--port")
                .workingDir("/tmp")
                .env("A", "1")
                .build();
        assertEquals(List.of("dotnet", "worker.dll", "--port"), config.args());
        assertEquals(Path.of("/tmp"), config.workingDir());
        assertEquals("1", config.env().get("A"));
        assertFalse(config.redirectErrorStream());
    }

    @Test
    void testBuildWithoutArgs() {
        assertThrows(IllegalArgumentException.class, () -> ProcessBuilder.create().build());
    }

}
