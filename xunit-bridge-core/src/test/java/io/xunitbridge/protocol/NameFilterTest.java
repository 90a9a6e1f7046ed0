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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameFilterTest {

    @Test
    void testAllAcceptsEverything() {
        NameFilter all = NameFilter.all();
        assertTrue(all.isAll());
        assertTrue(all.accepts("anything"));
        assertEquals(List.of(), all.getIds());
    }

    @Test
    void testIdsKeepOrderAndDropDuplicates() {
        NameFilter filter = NameFilter.of("c", "a", "c", "b");
        assertFalse(filter.isAll());
        assertEquals(List.of("c", "a", "b"), filter.getIds());
        assertEquals(3, filter.size());
        assertTrue(filter.accepts("a"));
        assertFalse(filter.accepts("d"));
        assertTrue(filter.accepts(new TestCaseDescriptor("b", "B")));
    }

    @Test
    void testEmptyFilterIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> NameFilter.of(List.of()));
        assertThrows(IllegalArgumentException.class, () -> NameFilter.of());
        assertThrows(IllegalArgumentException.class, () -> NameFilter.of("a", ""));
    }

    @Test
    void testOfTestCases() {
        NameFilter filter = NameFilter.ofTestCases(List.of(
                new TestCaseDescriptor("x", "X"),
                new TestCaseDescriptor("y", "Y")));
        assertEquals(NameFilter.of("x", "y"), filter);
        assertNotEquals(NameFilter.all(), filter);
    }

}
