package org.corvo.lang.dsl;

/**
 * remove VALUE from LIST
 */
public record ListRemove(
        CorvoExpression list,
        CorvoExpression value,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitListRemove(this);
    }
}
