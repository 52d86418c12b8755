package org.corvo.engine.error;

/**
 * Raised when CSV rows have inconsistent widths or a cell cannot be written as plain CSV.
 */
public class MalformedCsvException extends CorvoRuntimeException {

    public MalformedCsvException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MALFORMED_CSV;
    }
}
