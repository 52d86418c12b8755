package org.corvo.lang.dsl;

import java.util.List;
import java.util.Objects;

/**
 * List iteration: for each ITEM in LIST BODY
 */
public record ForEachLoop(
        String itemName,
        CorvoExpression list,
        List<CorvoStatement> body,
        int line) implements CorvoStatement {

    public ForEachLoop {
        Objects.requireNonNull(itemName, "Item name cannot be null");
        Objects.requireNonNull(list, "List cannot be null");
        body = List.copyOf(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitForEach(this);
    }
}
