package org.corvo.lang.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Conditional: if COND then BODY [otherwise BODY]
 *
 * @param condition The condition (a comparison or and/or of comparisons)
 * @param thenBlock Statements run when the condition holds
 * @param elseBlock Statements run otherwise; empty when there is no otherwise
 *                  branch
 * @param line      Source line
 */
public record IfStatement(
        CorvoExpression condition,
        List<CorvoStatement> thenBlock,
        List<CorvoStatement> elseBlock,
        int line) implements CorvoStatement {

    public IfStatement {
        Objects.requireNonNull(condition, "Condition cannot be null");
        thenBlock = List.copyOf(thenBlock);
        elseBlock = elseBlock != null ? List.copyOf(elseBlock) : List.of();
    }

    public IfStatement(CorvoExpression condition, List<CorvoStatement> thenBlock, int line) {
        this(condition, thenBlock, List.of(), line);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitIf(this);
    }
}
