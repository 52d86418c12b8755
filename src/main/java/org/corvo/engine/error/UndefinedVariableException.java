package org.corvo.engine.error;

/**
 * Raised when a program reads a name that has not been assigned.
 */
public class UndefinedVariableException extends CorvoRuntimeException {

    public UndefinedVariableException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNDEFINED_VARIABLE;
    }
}
