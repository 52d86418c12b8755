package org.corvo.lang.dsl;

/**
 * Input statement: ask PROMPT remember as NAME
 */
public record Ask(
        CorvoExpression prompt,
        String target,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitAsk(this);
    }
}
