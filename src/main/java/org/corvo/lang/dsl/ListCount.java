package org.corvo.lang.dsl;

/**
 * count of SOURCE
 */
public record ListCount(CorvoExpression source) implements CorvoExpression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitListCount(this);
    }
}
