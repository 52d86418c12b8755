package org.corvo.lang.dsl;

/**
 * read csv PATH remember as NAME
 */
public record CsvRead(
        CorvoExpression path,
        String target,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitCsvRead(this);
    }
}
