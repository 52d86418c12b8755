package org.corvo.engine.error;

/**
 * Categories of failure a Corvo run can end with.
 */
public enum ErrorKind {
    SYNTAX("Syntax error"),
    UNDEFINED_VARIABLE("Undefined variable"),
    UNDEFINED_SECTION("Undefined section"),
    TYPE_MISMATCH("Type mismatch"),
    INVALID_INDEX("Invalid index"),
    INVALID_ARGUMENT("Invalid argument"),
    FILE_NOT_FOUND("File not found"),
    FILE_ACCESS("File access error"),
    MALFORMED_CSV("Malformed CSV"),
    INTERNAL("Internal error");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
