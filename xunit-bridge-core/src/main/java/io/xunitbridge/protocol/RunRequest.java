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

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything the worker needs to run one batch. Built once per run.
 *
 * @param assemblyPath      the test assembly to load
 * @param configPath        framework configuration file, may be null
 * @param filter            ids to run, {@link NameFilter#all()} to run everything discovered
 * @param supportAssemblies extra assemblies the worker must be able to resolve
 * @param crashLogPath      file the worker may write diagnostics to if it dies, may be null
 */
public record RunRequest(
        String assemblyPath,
        String configPath,
        NameFilter filter,
        List<String> supportAssemblies,
        Path crashLogPath
) {

    public RunRequest {
        Objects.requireNonNull(assemblyPath, "assemblyPath");
        filter = filter == null ? NameFilter.all() : filter;
        supportAssemblies = supportAssemblies == null ? List.of() : List.copyOf(supportAssemblies);
    }

}
