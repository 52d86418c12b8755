package org.corvo.engine.execution;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for one interpreter.
 *
 * @param workingDirectory    Base directory for relative file and CSV paths
 * @param whileIterationLimit Maximum iterations of a single while loop before
 *                            it is stopped with a warning; 0 means unlimited
 * @param fileAccessEnabled   When false every file and CSV statement fails
 * @param charset             Encoding for text and CSV files
 */
public record InterpreterOptions(
        Path workingDirectory,
        int whileIterationLimit,
        boolean fileAccessEnabled,
        Charset charset) {

    /**
     * While-loop guard applied by {@link #sandboxed()}.
     */
    public static final int SANDBOX_WHILE_LIMIT = 10_000;

    public InterpreterOptions {
        Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
        Objects.requireNonNull(charset, "Charset cannot be null");
        if (whileIterationLimit < 0) {
            throw new IllegalArgumentException("While iteration limit cannot be negative: " + whileIterationLimit);
        }
    }

    /**
     * Unlimited while loops, file access relative to the current directory, UTF-8.
     */
    public static InterpreterOptions defaults() {
        return new InterpreterOptions(Path.of(""), 0, true, StandardCharsets.UTF_8);
    }

    /**
     * No file access and a guard on while loops, for running untrusted programs.
     */
    public static InterpreterOptions sandboxed() {
        return new InterpreterOptions(Path.of(""), SANDBOX_WHILE_LIMIT, false, StandardCharsets.UTF_8);
    }

    public InterpreterOptions withWorkingDirectory(Path directory) {
        return new InterpreterOptions(directory, whileIterationLimit, fileAccessEnabled, charset);
    }

    public InterpreterOptions withWhileIterationLimit(int limit) {
        return new InterpreterOptions(workingDirectory, limit, fileAccessEnabled, charset);
    }

    public InterpreterOptions withFileAccess(boolean enabled) {
        return new InterpreterOptions(workingDirectory, whileIterationLimit, enabled, charset);
    }

    public boolean hasWhileLimit() {
        return whileIterationLimit > 0;
    }
}
