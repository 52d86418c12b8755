package org.corvo.engine.value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Signed decimal number.
 *
 * Backed by BigDecimal so that integer and fractional arithmetic share one
 * representation. Equality ignores scale: 2 and 2.0 are the same number.
 *
 * @param value The numeric value
 */
public record NumberValue(BigDecimal value) implements Value {

    /**
     * Precision used for division, whose exact result may not terminate.
     */
    public static final MathContext DIVISION_CONTEXT = MathContext.DECIMAL64;

    public NumberValue {
        Objects.requireNonNull(value, "Number value cannot be null");
    }

    public static NumberValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    /**
     * Parses a number literal such as "12", "-3" or "2.5".
     */
    public static NumberValue parse(String text) {
        return new NumberValue(new BigDecimal(text));
    }

    public NumberValue plus(NumberValue other) {
        return new NumberValue(value.add(other.value));
    }

    public NumberValue minus(NumberValue other) {
        return new NumberValue(value.subtract(other.value));
    }

    public NumberValue times(NumberValue other) {
        return new NumberValue(value.multiply(other.value));
    }

    /**
     * Divides by a non-zero divisor. Callers check for zero first.
     */
    public NumberValue dividedBy(NumberValue divisor) {
        return new NumberValue(value.divide(divisor.value, DIVISION_CONTEXT));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    public boolean isIntegral() {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    /**
     * Truncates toward zero.
     */
    public BigDecimal truncated() {
        return value.setScale(0, RoundingMode.DOWN);
    }

    public int compareTo(NumberValue other) {
        return value.compareTo(other.value);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.NUMBER;
    }

    /**
     * Canonical decimal text: no exponent, no trailing fractional zeros.
     */
    @Override
    public String displayText() {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof NumberValue other && value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return displayText();
    }
}
