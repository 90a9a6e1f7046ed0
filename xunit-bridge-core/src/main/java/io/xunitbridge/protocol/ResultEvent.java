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

import java.time.Duration;

/**
 * Execution events streamed by the worker during a run.
 * <p>
 * For a given id, {@link TestStarted} precedes exactly one terminal event
 * ({@link TestPassed}, {@link TestFailed} or {@link TestSkipped}).
 * {@link RunFinished} is always the last event of a run.
 */
public sealed interface ResultEvent extends WorkerMessage permits
        ResultEvent.TestStarted,
        ResultEvent.TestPassed,
        ResultEvent.TestFailed,
        ResultEvent.TestSkipped,
        ResultEvent.RunFinished {

    record TestStarted(String id) implements ResultEvent {
    }

    record TestPassed(String id, Duration duration) implements ResultEvent {
    }

    record TestFailed(String id, String message, String stackTrace) implements ResultEvent {
    }

    record TestSkipped(String id, String reason) implements ResultEvent {
    }

    record RunFinished() implements ResultEvent {
    }

    /**
     * Id of the test this event is about, null for {@link RunFinished}.
     */
    static String testId(ResultEvent event) {
        if (event instanceof TestStarted e) {
            return e.id();
        } else if (event instanceof TestPassed e) {
            return e.id();
        } else if (event instanceof TestFailed e) {
            return e.id();
        } else if (event instanceof TestSkipped e) {
            return e.id();
        }
        return null;
    }

    static boolean isTerminal(ResultEvent event) {
        return event instanceof TestPassed || event instanceof TestFailed || event instanceof TestSkipped;
    }

}
