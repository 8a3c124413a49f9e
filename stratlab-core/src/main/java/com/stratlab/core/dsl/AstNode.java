package com.stratlab.core.dsl;

import com.stratlab.core.indicators.IndicatorKind;

import java.util.ArrayList;
import java.util.List;

/**
 * AST Node types for the rule parser.
 * A parsed rules string is a flat list of {@link Comparison} and {@link Operator}
 * nodes; the remaining node types appear inside comparisons.
 */
public sealed interface AstNode {

    /**
     * Numeric literal: 30, 0.95, 1e3
     */
    record Value(double value) implements AstNode {}

    /**
     * Bar variable: price, open, high, low, close, volume, entry_price
     */
    record Variable(String name) implements AstNode {}

    /**
     * Indicator call: sma(200), rsi(14), macd(), bb_upper(20, 2)
     */
    record IndicatorCall(IndicatorKind kind, List<Argument> arguments) implements AstNode {
        public IndicatorCall {
            arguments = List.copyOf(arguments);
        }

        /**
         * Numeric arguments in call order; symbolic arguments are skipped.
         */
        public List<Double> numericArguments() {
            List<Double> values = new ArrayList<>();
            for (Argument argument : arguments) {
                if (argument instanceof Argument.Number number) {
                    values.add(number.value());
                }
            }
            return values;
        }
    }

    /**
     * Arithmetic expression: left * right, left - right, etc.
     */
    record Arithmetic(ArithmeticOperator operator, AstNode left, AstNode right) implements AstNode {}

    /**
     * Comparison: left > right, left <= right, etc.
     */
    record Comparison(ComparisonOperator operator, AstNode left, AstNode right) implements AstNode {}

    /**
     * Logical operator between conditions: AND, OR, NOT
     */
    record Operator(LogicalOperator operator) implements AstNode {}

    /**
     * Indicator call argument: a number or a bare lowercase identifier.
     */
    sealed interface Argument {
        record Number(double value) implements Argument {}
        record Symbol(String name) implements Argument {}
    }
}
