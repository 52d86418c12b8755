package org.corvo.engine.error;

/**
 * Raised when an operator or built-in receives a kind of value it cannot work with.
 */
public class TypeMismatchException extends CorvoRuntimeException {

    public TypeMismatchException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TYPE_MISMATCH;
    }
}
