package org.corvo.engine.value;

/**
 * Absence of a value.
 */
public record NoneValue() implements Value {

    public static final NoneValue INSTANCE = new NoneValue();

    @Override
    public ValueKind kind() {
        return ValueKind.NONE;
    }

    @Override
    public String displayText() {
        return "none";
    }
}
