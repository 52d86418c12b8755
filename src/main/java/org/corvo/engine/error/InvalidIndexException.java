package org.corvo.engine.error;

/**
 * Raised when a list, row, column or cell position is outside the current bounds.
 */
public class InvalidIndexException extends CorvoRuntimeException {

    public InvalidIndexException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_INDEX;
    }
}
