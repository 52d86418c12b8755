package org.corvo.lang.dsl;

/**
 * read from PATH remember as NAME
 */
public record FileRead(
        CorvoExpression path,
        String target,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitFileRead(this);
    }
}
