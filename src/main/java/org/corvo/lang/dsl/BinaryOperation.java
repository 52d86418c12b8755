package org.corvo.lang.dsl;

import java.util.Objects;

/**
 * Binary operation: LEFT op RIGHT
 *
 * Covers arithmetic (plus, minus, times, divided by), comparisons and the
 * and/or combinators used in conditions.
 */
public record BinaryOperation(
        BinaryOperator operator,
        CorvoExpression left,
        CorvoExpression right) implements CorvoExpression {

    public BinaryOperation {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBinaryOperation(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.keyword() + " " + right + ")";
    }
}
