package org.corvo.engine.error;

/**
 * Raised when a file or CSV read names a file that does not exist.
 */
public class CorvoFileNotFoundException extends CorvoRuntimeException {

    public CorvoFileNotFoundException(String message) {
        super(message);
    }

    public CorvoFileNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FILE_NOT_FOUND;
    }
}
