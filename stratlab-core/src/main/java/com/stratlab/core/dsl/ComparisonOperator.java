package com.stratlab.core.dsl;

/**
 * Comparison operators. Declaration order is the scan order used to split a
 * condition, longer symbols first so that {@code >=} is never read as {@code >}.
 */
public enum ComparisonOperator {
    GREATER_EQUAL(">="),
    LESS_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    GREATER(">"),
    LESS("<");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Compare two values. Any comparison involving NaN is false, {@code !=} included.
     */
    public boolean test(double left, double right) {
        if (Double.isNaN(left) || Double.isNaN(right)) {
            return false;
        }
        return switch (this) {
            case GREATER_EQUAL -> left >= right;
            case LESS_EQUAL -> left <= right;
            case EQUAL -> left == right;
            case NOT_EQUAL -> left != right;
            case GREATER -> left > right;
            case LESS -> left < right;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
