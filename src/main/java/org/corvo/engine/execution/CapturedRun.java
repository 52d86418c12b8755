package org.corvo.engine.execution;

import org.corvo.engine.error.ErrorReport;

import java.util.Optional;

/**
 * Outcome of running a program with its output captured in memory.
 *
 * @param output      Everything the program displayed, one line per display
 * @param diagnostics Warnings written while running
 * @param error       The error that ended the run, if any
 */
public record CapturedRun(String output, String diagnostics, Optional<ErrorReport> error) {

    public boolean succeeded() {
        return error.isEmpty();
    }

    /**
     * @return Displayed lines, without the trailing empty entry
     */
    public String[] outputLines() {
        if (output.isEmpty()) {
            return new String[0];
        }
        return output.split("\\R");
    }
}
