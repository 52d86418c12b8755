package org.corvo.engine.error;

/**
 * Raised for values of the right kind but an unusable amount: negative repeat counts, division by zero, removing an absent element.
 */
public class InvalidArgumentException extends CorvoRuntimeException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_ARGUMENT;
    }
}
