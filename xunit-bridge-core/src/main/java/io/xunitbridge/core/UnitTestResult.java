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
package io.xunitbridge.core;

import io.xunitbridge.client.WorkerCrashedException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of one run: per-test counters and failures, plus a run-level
 * message, stack trace and exception when the run itself did not complete.
 */
public class UnitTestResult {

    private int passed;
    private int failed;
    private int skipped;
    private final List<TestFailure> failures = new ArrayList<>();
    private boolean canceled;
    private boolean faulted;
    private String message;
    private String stackTrace;
    private Throwable exception;
    private Path crashLogPath;
    private String crashLogExcerpt;
    private Duration duration = Duration.ZERO;

    public UnitTestResult() {
    }

    public static UnitTestResult empty() {
        return new UnitTestResult();
    }

    public static UnitTestResult createFailure(Throwable error) {
        return createFailure(error.getMessage(), error);
    }

    public static UnitTestResult createFailure(String message, Throwable error) {
        UnitTestResult result = new UnitTestResult();
        result.faulted = true;
        result.message = message;
        result.exception = error;
        result.stackTrace = error == null ? null : stackTraceOf(error);
        if (error instanceof WorkerCrashedException crash) {
            result.crashLogPath = crash.getCrashLogPath();
        }
        return result;
    }

    /**
     * @param label localized text shown to the user, no stack trace is attached
     */
    public static UnitTestResult createCanceled(String label) {
        UnitTestResult result = new UnitTestResult();
        result.canceled = true;
        result.message = label;
        return result;
    }

    synchronized void addPassed() {
        passed++;
    }

    synchronized void addSkipped() {
        skipped++;
    }

    synchronized void addFailure(TestFailure failure) {
        failed++;
        failures.add(failure);
    }

    void setDuration(Duration duration) {
        this.duration = duration;
    }

    void setCrashLogExcerpt(String crashLogExcerpt) {
        this.crashLogExcerpt = crashLogExcerpt;
    }

    public synchronized int getPassedCount() {
        return passed;
    }

    public synchronized int getFailedCount() {
        return failed;
    }

    public synchronized int getSkippedCount() {
        return skipped;
    }

    public synchronized int getTotalCount() {
        return passed + failed + skipped;
    }

    public synchronized List<TestFailure> getFailures() {
        return List.copyOf(failures);
    }

    public boolean isCanceled() {
        return canceled;
    }

    /**
     * True when the run completed and no test case failed.
     */
    public synchronized boolean isPassed() {
        return !canceled && !faulted && failed == 0;
    }

    public boolean isFailed() {
        return !canceled && !isPassed();
    }

    /**
     * True when the run itself did not complete, as opposed to test cases failing.
     */
    public boolean isFaulted() {
        return faulted;
    }

    public String getMessage() {
        return message;
    }

    public String getStackTrace() {
        return stackTrace;
    }

    public Throwable getException() {
        return exception;
    }

    public Path getCrashLogPath() {
        return crashLogPath;
    }

    public String getCrashLogExcerpt() {
        return crashLogExcerpt;
    }

    public Duration getDuration() {
        return duration;
    }

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("passed", passed);
        map.put("failed", failed);
        map.put("skipped", skipped);
        map.put("canceled", canceled);
        map.put("faulted", faulted);
        map.put("durationMillis", duration.toMillis());
        if (message != null) {
            map.put("message", message);
        }
        if (crashLogPath != null) {
            map.put("crashLogPath", crashLogPath.toString());
        }
        if (!failures.isEmpty()) {
            List<Map<String, Object>> list = new ArrayList<>(failures.size());
            for (TestFailure failure : failures) {
                Map<String, Object> fm = new LinkedHashMap<>();
                fm.put("id", failure.id());
                fm.put("displayName", failure.displayName());
                fm.put("message", failure.message());
                list.add(fm);
            }
            map.put("failures", list);
        }
        return map;
    }

    @Override
    public synchronized String toString() {
        if (canceled) {
            return message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("passed: ").append(passed)
                .append(", failed: ").append(failed)
                .append(", skipped: ").append(skipped);
        if (message != null) {
            sb.append(" (").append(message).append(')');
        }
        return sb.toString();
    }

    static String stackTraceOf(Throwable error) {
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

}
