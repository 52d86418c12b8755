package org.corvo.lang.dsl;

/**
 * get row ROW column COLUMN from TABLE
 */
public record CellAccess(
        CorvoExpression table,
        CorvoExpression row,
        CorvoExpression column) implements CorvoExpression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCellAccess(this);
    }
}
