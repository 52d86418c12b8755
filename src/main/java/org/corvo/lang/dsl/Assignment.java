package org.corvo.lang.dsl;

import java.util.Objects;

/**
 * Assignment: the NAME is EXPR
 */
public record Assignment(
        String name,
        CorvoExpression value,
        int line) implements CorvoStatement {

    public Assignment {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitAssignment(this);
    }
}
