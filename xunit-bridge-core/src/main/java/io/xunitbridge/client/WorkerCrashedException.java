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
package io.xunitbridge.client;

import java.nio.file.Path;

/**
 * The worker process exited while an operation was still in flight.
 */
public class WorkerCrashedException extends BridgeException {

    private final int exitCode;
    private final Path crashLogPath;

    public WorkerCrashedException(int exitCode, Path crashLogPath) {
        super("worker process exited unexpectedly with code " + exitCode
                + (crashLogPath == null ? "" : ", crash log: " + crashLogPath));
        this.exitCode = exitCode;
        this.crashLogPath = crashLogPath;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Where the worker may have written diagnostics, null if none was requested.
     */
    public Path getCrashLogPath() {
        return crashLogPath;
    }

}
