package org.corvo.lang.dsl;

/**
 * write CONTENT to PATH
 */
public record FileWrite(
        CorvoExpression content,
        CorvoExpression path,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitFileWrite(this);
    }
}
