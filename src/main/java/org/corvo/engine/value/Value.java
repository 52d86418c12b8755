package org.corvo.engine.value;

/**
 * Sealed interface representing runtime values of a Corvo program.
 *
 * Type hierarchy:
 * Value
 * ├── NumberValue (integer and fractional arithmetic)
 * ├── StringValue (text)
 * ├── ListValue (ordered, mutable, 1-based from the program's point of view)
 * ├── TableValue (rectangular grid of String cells loaded from CSV)
 * └── NoneValue (absence of a value)
 */
public sealed interface Value
        permits NumberValue, StringValue, ListValue, TableValue, NoneValue {

    /**
     * @return The kind tag of this value
     */
    ValueKind kind();

    /**
     * Returns the canonical text used by display, string concatenation and
     * file writes.
     *
     * @return The display text
     * @throws org.corvo.engine.error.TypeMismatchException if this kind of value
     *                                                      cannot be displayed
     */
    String displayText();
}
