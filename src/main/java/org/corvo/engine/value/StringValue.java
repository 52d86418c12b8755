package org.corvo.engine.value;

import java.util.Objects;

/**
 * A sequence of characters.
 *
 * @param value The text content
 */
public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "String value cannot be null");
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.STRING;
    }

    @Override
    public String displayText() {
        return value;
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
