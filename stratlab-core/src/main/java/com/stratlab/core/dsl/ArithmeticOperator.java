package com.stratlab.core.dsl;

/**
 * Arithmetic operators. Declaration order is the scan order used to split an
 * expression.
 */
public enum ArithmeticOperator {
    MULTIPLY('*'),
    DIVIDE('/'),
    PLUS('+'),
    MINUS('-');

    private final char symbol;

    ArithmeticOperator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * IEEE arithmetic: NaN propagates, division by zero gives an infinity or NaN.
     */
    public double apply(double left, double right) {
        return switch (this) {
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
            case PLUS -> left + right;
            case MINUS -> left - right;
        };
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
