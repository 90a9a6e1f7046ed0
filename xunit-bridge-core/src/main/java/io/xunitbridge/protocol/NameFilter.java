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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The set of test case ids a run is restricted to.
 * <p>
 * An explicit filter always names at least one id, "run everything" is the
 * separate {@link #all()} value. Ids keep their insertion order, which is the
 * order they are sent to the worker.
 */
public final class NameFilter {

    private static final NameFilter ALL = new NameFilter(null);

    private final Set<String> ids;

    private NameFilter(Set<String> ids) {
        this.ids = ids;
    }

    public static NameFilter all() {
        return ALL;
    }

    public static NameFilter of(String... ids) {
        return of(List.of(ids));
    }

    public static NameFilter of(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("name filter must contain at least one test case id");
        }
        Set<String> set = new LinkedHashSet<>();
        for (String id : ids) {
            if (id == null || id.isEmpty()) {
                throw new IllegalArgumentException("name filter contains an empty test case id");
            }
            set.add(id);
        }
        return new NameFilter(Collections.unmodifiableSet(set));
    }

    public static NameFilter ofTestCases(Collection<TestCaseDescriptor> testCases) {
        List<String> list = new ArrayList<>(testCases.size());
        for (TestCaseDescriptor testCase : testCases) {
            list.add(testCase.getId());
        }
        return of(list);
    }

    public boolean isAll() {
        return ids == null;
    }

    public boolean accepts(String id) {
        return ids == null || ids.contains(id);
    }

    public boolean accepts(TestCaseDescriptor testCase) {
        return accepts(testCase.getId());
    }

    /**
     * The selected ids in insertion order, empty for {@link #all()}.
     */
    public List<String> getIds() {
        return ids == null ? List.of() : List.copyOf(ids);
    }

    public int size() {
        return ids == null ? -1 : ids.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NameFilter that)) {
            return false;
        }
        return ids == null ? that.ids == null : ids.equals(that.ids);
    }

    @Override
    public int hashCode() {
        return ids == null ? 0 : ids.hashCode();
    }

    @Override
    public String toString() {
        return ids == null ? "*" : ids.toString();
    }

}
