package org.corvo.lang.dsl;

/**
 * Output statement: display EXPR
 */
public record Display(
        CorvoExpression value,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitDisplay(this);
    }
}
