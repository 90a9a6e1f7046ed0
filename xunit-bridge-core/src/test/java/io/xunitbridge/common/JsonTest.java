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
package io.xunitbridge.common;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    @Test
    void testGetAndDefaults() {
        Json json = Json.of("{ worker: { command: 'dotnet w.dll' }, timeout: 5 }");
        assertTrue(json.isObject());
        assertEquals("dotnet w.dll", json.get("worker.command"));
        assertEquals(5, (Integer) json.get("timeout"));
        assertEquals("x", json.get("missing", "x"));
        assertTrue(json.getOptional("worker.missing").isEmpty());
        assertTrue(json.getOptional("worker").isPresent());
        assertTrue(json.getOptional("worker.env").isEmpty());
    }

    @Test
    void testArray() {
        Json json = Json.of(List.of(1, 2));
        assertFalse(json.isObject());
        assertEquals(2, (Integer) json.get("[1]"));
    }

    @Test
    void testParseStrictRejectsLenientInput() {
        assertThrows(RuntimeException.class, () -> Json.parseStrict("{ command: 'ready' }"));
        Object parsed = Json.parseStrict("{\"command\":\"ready\"}");
        assertEquals(Map.of("command", "ready"), parsed);
    }

    @Test
    void testStringifyKeepsOrder() {
        Map<String, Object> map = Json.of("{\"b\":1,\"a\":[true,null]}").asMap();
        assertEquals("{\"b\":1,\"a\":[true,null]}", Json.stringifyStrict(map));
        assertEquals("", Json.stringifyStrict(null));
    }

    @Test
    void testBlankInput() {
        assertThrows(IllegalArgumentException.class, () -> Json.of(" "));
        assertThrows(IllegalArgumentException.class, () -> Json.of(null));
    }

}
