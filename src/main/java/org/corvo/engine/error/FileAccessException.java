package org.corvo.engine.error;

/**
 * Raised when a file cannot be read or written, or file access is disabled.
 */
public class FileAccessException extends CorvoRuntimeException {

    public FileAccessException(String message) {
        super(message);
    }

    public FileAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FILE_ACCESS;
    }
}
