package org.corvo.lang.dsl;

/**
 * Exception thrown when Corvo source text does not match the grammar.
 * Carries the source location of the offending token when it is known.
 */
public class CorvoParseException extends RuntimeException {

    private final int line;
    private final int column;

    public CorvoParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public CorvoParseException(String message, int line, int column) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
