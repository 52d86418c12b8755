package org.corvo.lang.dsl;

import java.util.List;

/**
 * List literal: [e1, e2, ...]
 */
public record ListLiteral(List<CorvoExpression> elements) implements CorvoExpression {

    public ListLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitListLiteral(this);
    }
}
