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
package io.xunitbridge.tree;

import java.nio.file.Path;
import java.util.List;

/**
 * Root of a test tree: everything discovered in one test assembly.
 */
public class AssemblySuite extends TestGroup {

    private final String assemblyPath;
    private String configPath;
    private List<String> supportAssemblies = List.of();

    public AssemblySuite(String assemblyPath) {
        super(nameOf(assemblyPath));
        this.assemblyPath = assemblyPath;
    }

    private static String nameOf(String assemblyPath) {
        Path fileName = Path.of(assemblyPath).getFileName();
        return fileName == null ? assemblyPath : fileName.toString();
    }

    public String getAssemblyPath() {
        return assemblyPath;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public List<String> getSupportAssemblies() {
        return supportAssemblies;
    }

    public void setSupportAssemblies(List<String> supportAssemblies) {
        this.supportAssemblies = supportAssemblies == null ? List.of() : List.copyOf(supportAssemblies);
    }

}
