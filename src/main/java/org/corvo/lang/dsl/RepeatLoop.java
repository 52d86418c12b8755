package org.corvo.lang.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Counted loop: repeat COUNT loops BODY
 */
public record RepeatLoop(
        CorvoExpression count,
        List<CorvoStatement> body,
        int line) implements CorvoStatement {

    public RepeatLoop {
        Objects.requireNonNull(count, "Count cannot be null");
        body = List.copyOf(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitRepeat(this);
    }
}
