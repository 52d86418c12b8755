package org.corvo.lang.dsl;

/**
 * get column INDEX from TABLE
 */
public record ColumnAccess(
        CorvoExpression table,
        CorvoExpression column) implements CorvoExpression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnAccess(this);
    }
}
