package org.corvo.lang.dsl;

/**
 * append VALUE to LIST
 */
public record ListAppend(
        CorvoExpression list,
        CorvoExpression value,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitListAppend(this);
    }
}
