package org.corvo.lang.dsl;

/**
 * set TABLE row R column C to VALUE
 *
 * @param table  The table expression
 * @param row    1-based row expression
 * @param column 1-based column expression
 * @param value  New cell content, stored as its display text
 * @param line   Source line
 */
public record CsvSetCell(
        CorvoExpression table,
        CorvoExpression row,
        CorvoExpression column,
        CorvoExpression value,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitCsvSetCell(this);
    }
}
