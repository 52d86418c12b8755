package org.corvo.engine.error;

/**
 * Raised when a program calls a section that has not been defined.
 */
public class UndefinedSectionException extends CorvoRuntimeException {

    public UndefinedSectionException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNDEFINED_SECTION;
    }
}
