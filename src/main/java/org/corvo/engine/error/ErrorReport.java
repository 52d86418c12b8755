package org.corvo.engine.error;

import java.util.Objects;

/**
 * A failure converted into a single human-readable message.
 *
 * @param kind    The category of the failure
 * @param line    1-based source line, or -1 when unknown
 * @param message Description naming the failing construct and value
 */
public record ErrorReport(ErrorKind kind, int line, String message) {

    public ErrorReport {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public boolean hasLine() {
        return line >= 0;
    }

    /**
     * Renders the report as one line, e.g.
     * "Undefined variable on line 4: 'total' has not been given a value yet".
     * Syntax error messages already start with their location.
     */
    public String format() {
        if (kind == ErrorKind.SYNTAX) {
            return kind.displayName() + " at " + message;
        }
        if (hasLine()) {
            return kind.displayName() + " on line " + line + ": " + message;
        }
        return kind.displayName() + ": " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}
