package org.corvo.engine.error;

/**
 * Base class for failures raised while a program is running.
 *
 * The statement executor stamps the source line of the innermost failing
 * statement onto the exception; the first stamp wins.
 */
public abstract class CorvoRuntimeException extends RuntimeException {

    private int line = -1;

    protected CorvoRuntimeException(String message) {
        super(message);
    }

    protected CorvoRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return The category of this failure
     */
    public abstract ErrorKind kind();

    /**
     * Records the line of the statement that failed, unless one is already set.
     *
     * @return this exception, for rethrowing
     */
    public CorvoRuntimeException atLine(int line) {
        if (this.line < 0) {
            this.line = line;
        }
        return this;
    }

    public int getLine() {
        return line;
    }

    public boolean hasLine() {
        return line >= 0;
    }
}
