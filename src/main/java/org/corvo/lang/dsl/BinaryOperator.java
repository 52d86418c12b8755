package org.corvo.lang.dsl;

/**
 * Operators of {@link BinaryOperation}, named by their Corvo keywords.
 */
public enum BinaryOperator {
    PLUS("plus"),
    MINUS("minus"),
    TIMES("times"),
    DIVIDE("divided by"),
    IS_EQUAL("is equal to"),
    IS_GREATER_THAN("is greater than"),
    IS_LESS_THAN("is less than"),
    AND("and"),
    OR("or");

    private final String keyword;

    BinaryOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * True for operators whose result is a condition rather than a value.
     */
    public boolean isCondition() {
        return isComparison() || this == AND || this == OR;
    }

    public boolean isComparison() {
        return this == IS_EQUAL || this == IS_GREATER_THAN || this == IS_LESS_THAN;
    }
}
