package org.corvo.engine.value;

/**
 * Kind tags for runtime values, used in type mismatch messages.
 */
public enum ValueKind {
    NUMBER("Number"),
    STRING("String"),
    LIST("List"),
    TABLE("Table"),
    NONE("None");

    private final String displayName;

    ValueKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
