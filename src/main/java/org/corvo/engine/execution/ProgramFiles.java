package org.corvo.engine.execution;

import org.corvo.engine.error.CorvoFileNotFoundException;
import org.corvo.engine.error.FileAccessException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * File access on behalf of a running program.
 *
 * Each call opens, fully consumes and closes its file; nothing is held
 * between statements. I/O failures are translated into Corvo errors.
 */
final class ProgramFiles {

    private final InterpreterOptions options;

    ProgramFiles(InterpreterOptions options) {
        this.options = options;
    }

    String readText(String path) {
        Path file = resolve(path);
        try {
            return Files.readString(file, options.charset());
        } catch (NoSuchFileException e) {
            throw new CorvoFileNotFoundException("There is no file named '" + path + "'", e);
        } catch (IOException e) {
            throw new FileAccessException("Cannot read '" + path + "': " + e.getMessage(), e);
        }
    }

    void writeText(String path, String content) {
        Path file = resolve(path);
        try {
            Files.writeString(file, content, options.charset());
        } catch (IOException e) {
            throw new FileAccessException("Cannot write '" + path + "': " + e.getMessage(), e);
        }
    }

    private Path resolve(String path) {
        if (!options.fileAccessEnabled()) {
            throw new FileAccessException("File access is disabled; cannot use '" + path + "'");
        }
        try {
            return options.workingDirectory().resolve(path);
        } catch (InvalidPathException e) {
            throw new FileAccessException("'" + path + "' is not a valid file path", e);
        }
    }
}
