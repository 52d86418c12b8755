package org.corvo.lang.dsl;

/**
 * 1-based element access: SOURCE at INDEX
 */
public record IndexAccess(
        CorvoExpression source,
        CorvoExpression index) implements CorvoExpression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitIndexAccess(this);
    }
}
