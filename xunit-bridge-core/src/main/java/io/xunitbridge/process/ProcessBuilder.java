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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Builder for ProcessConfig. Provides fluent API for worker process configuration.
 */
public class ProcessBuilder {

    private List<String> args = new ArrayList<>();
    private Path workingDir;
    private Map<String, String> env = new HashMap<>();
    private boolean redirectErrorStream = false;
    private Consumer<ProcessEvent> listener;

    private ProcessBuilder() {
    }

    public static ProcessBuilder create() {
        return new ProcessBuilder();
    }

    /**
     * Tokenize a command line string into arguments.
     * <p>
     * Behavior mirrors POSIX shell tokenization:
     * - Single quotes preserve literal content (no escape processing)
     * - Double quotes preserve content (backslash escapes work inside)
     * - Backslash outside quotes escapes any character
     * - Adjacent quoted/unquoted segments merge into single token
     */
    public static List<String> tokenize(String command) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean escaped = false;
        boolean quoted = false;

        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);

            if (escaped) {
                current.append(c);
                escaped = false;
                continue;
            }
            if (c == '\\' && !inSingleQuote) {
                escaped = true;
                continue;
            }
            if (c == '\'' && !inDoubleQuote) {
                inSingleQuote = !inSingleQuote;
                quoted = true;
                continue;
            }
            if (c == '"' && !inSingleQuote) {
                inDoubleQuote = !inDoubleQuote;
                quoted = true;
                continue;
            }
            if (Character.isWhitespace(c) && !inSingleQuote && !inDoubleQuote) {
                if (current.length() > 0 || quoted) {
                    result.add(current.toString());
                    current.setLength(0);
                    quoted = false;
                }
                continue;
            }
            current.append(c);
        }
        if (inSingleQuote || inDoubleQuote) {
            throw new IllegalArgumentException("unterminated quote in command: " + command);
        }
        if (current.length() > 0 || quoted) {
            result.add(current.toString());
        }
        return result;
    }

    // ========== Command Configuration ==========

    public ProcessBuilder line(String command) {
        this.args = tokenize(command);
        return this;
    }

    public ProcessBuilder args(String... args) {
        this.args = new ArrayList<>(List.of(args));
        return this;
    }

    public ProcessBuilder args(List<String> args) {
        this.args = new ArrayList<>(args);
        return this;
    }

    public ProcessBuilder arg(String arg) {
        this.args.add(arg);
        return this;
    }

    // ========== Environment Configuration ==========

    public ProcessBuilder workingDir(Path dir) {
        this.workingDir = dir;
        return this;
    }

    public ProcessBuilder workingDir(String dir) {
        this.workingDir = dir != null ? Path.of(dir) : null;
        return this;
    }

    public ProcessBuilder env(Map<String, String> env) {
        this.env = new HashMap<>(env);
        return this;
    }

    public ProcessBuilder env(String key, String value) {
        this.env.put(key, value);
        return this;
    }

    /**
     * Merge stderr into stdout. Off by default so protocol lines on stdout are
     * never interleaved with diagnostics.
     */
    public ProcessBuilder redirectErrorStream(boolean redirect) {
        this.redirectErrorStream = redirect;
        return this;
    }

    public ProcessBuilder listener(Consumer<ProcessEvent> listener) {
        this.listener = listener;
        return this;
    }

    // ========== Build ==========

    public ProcessConfig build() {
        return new ProcessConfig(args, workingDir, env, redirectErrorStream, listener);
    }

}
