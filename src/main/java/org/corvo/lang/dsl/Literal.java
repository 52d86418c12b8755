package org.corvo.lang.dsl;

import org.corvo.engine.value.NumberValue;
import org.corvo.engine.value.StringValue;
import org.corvo.engine.value.Value;

import java.util.Objects;

/**
 * Constant value written in the source: 42, 2.5, "text"
 */
public record Literal(Value value) implements CorvoExpression {

    public Literal {
        Objects.requireNonNull(value, "Literal value cannot be null");
    }

    public static Literal number(long value) {
        return new Literal(NumberValue.of(value));
    }

    public static Literal string(String value) {
        return new Literal(StringValue.of(value));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }
}
