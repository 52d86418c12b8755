package org.corvo.lang.dsl;

/**
 * Reference to a variable by name.
 */
public record VariableReference(String name) implements CorvoExpression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitVariableReference(this);
    }
}
