package org.corvo.lang.dsl;

/**
 * write TABLE to csv PATH
 */
public record CsvWrite(
        CorvoExpression table,
        CorvoExpression path,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitCsvWrite(this);
    }
}
