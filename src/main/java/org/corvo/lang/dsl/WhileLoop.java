package org.corvo.lang.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Conditional loop: while COND do BODY
 */
public record WhileLoop(
        CorvoExpression condition,
        List<CorvoStatement> body,
        int line) implements CorvoStatement {

    public WhileLoop {
        Objects.requireNonNull(condition, "Condition cannot be null");
        body = List.copyOf(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitWhile(this);
    }
}
