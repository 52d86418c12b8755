package org.corvo.lang.dsl;

/**
 * length of OPERAND
 */
public record TextLength(CorvoExpression operand) implements CorvoExpression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitTextLength(this);
    }
}
