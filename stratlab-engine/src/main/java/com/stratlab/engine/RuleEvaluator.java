package com.stratlab.engine;

import com.stratlab.core.dsl.AstNode;
import com.stratlab.core.dsl.LogicalOperator;
import com.stratlab.core.dsl.Parser;
import com.stratlab.core.indicators.IndicatorKey;
import com.stratlab.core.indicators.IndicatorTable;
import com.stratlab.core.indicators.Series;
import com.stratlab.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates parsed rules against an indicator table, one boolean per bar.
 *
 * Logical operators are reduced strictly left to right without precedence:
 * {@code A AND B OR C} is {@code (A AND B) OR C}. A binary operator combines
 * the operand before it with the next condition; {@code NOT} negates the next
 * condition, or the last one when nothing follows it.
 */
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final Parser parser;

    public RuleEvaluator() {
        this(new Parser());
    }

    public RuleEvaluator(Parser parser) {
        this.parser = parser;
    }

    /**
     * Parse rules for a run. A rules string that does not parse is logged and
     * treated as empty, which evaluates to false on every bar.
     */
    public List<AstNode> parseForRun(String rules) {
        if (rules == null || rules.isBlank()) {
            return List.of();
        }
        Parser.ParseResult result = parser.parse(rules);
        if (!result.success()) {
            log.warn("Rules '{}' failed to parse at '{}': {}; treating as always false",
                rules, result.fragment(), result.error());
            return List.of();
        }
        return result.nodes();
    }

    /**
     * Parse and evaluate a rules string with {@code entry_price} unbound.
     */
    public boolean[] evaluate(String rules, IndicatorTable table) {
        return evaluate(parseForRun(rules), table, Double.NaN);
    }

    /**
     * Evaluate parsed rules. {@code entryPrice} binds the {@code entry_price}
     * variable; pass NaN when no position is open.
     */
    public boolean[] evaluate(List<AstNode> nodes, IndicatorTable table, double entryPrice) {
        int n = table.size();
        Deque<boolean[]> stack = new ArrayDeque<>();
        LogicalOperator pending = null;
        boolean negateNext = false;

        for (AstNode node : nodes) {
            if (node instanceof AstNode.Operator op) {
                if (op.operator() == LogicalOperator.NOT) {
                    negateNext = !negateNext;
                } else if (stack.isEmpty()) {
                    log.debug("Ignoring {} with no left operand", op.operator());
                } else {
                    if (pending != null) {
                        log.debug("Ignoring {} followed by {}", pending, op.operator());
                    }
                    pending = op.operator();
                }
            } else if (node instanceof AstNode.Comparison comparison) {
                boolean[] signal = evaluateComparison(comparison, table, entryPrice);
                if (negateNext) {
                    signal = not(signal);
                    negateNext = false;
                }
                if (pending != null) {
                    boolean[] left = stack.pop();
                    signal = combine(pending, left, signal);
                    pending = null;
                }
                stack.push(signal);
            } else {
                throw new EvaluationException("Unexpected top-level node " + node.getClass().getSimpleName());
            }
        }

        if (negateNext && !stack.isEmpty()) {
            stack.push(not(stack.pop()));
        }
        if (pending != null) {
            log.debug("Ignoring trailing {}", pending);
        }
        if (stack.isEmpty()) {
            return new boolean[n];
        }
        if (stack.size() > 1) {
            log.debug("{} unjoined conditions left, using the first", stack.size());
        }
        return stack.peekLast();
    }

    /**
     * True if any comparison refers to {@code entry_price}.
     */
    public static boolean referencesEntryPrice(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            if (references(node, "entry_price")) {
                return true;
            }
        }
        return false;
    }

    private static boolean references(AstNode node, String variable) {
        if (node instanceof AstNode.Variable v) {
            return v.name().equals(variable);
        }
        if (node instanceof AstNode.Comparison c) {
            return references(c.left(), variable) || references(c.right(), variable);
        }
        if (node instanceof AstNode.Arithmetic a) {
            return references(a.left(), variable) || references(a.right(), variable);
        }
        return false;
    }

    // ========== Comparisons ==========

    private boolean[] evaluateComparison(AstNode.Comparison node, IndicatorTable table, double entryPrice) {
        double[] left = evaluateExpression(node.left(), table, entryPrice);
        double[] right = evaluateExpression(node.right(), table, entryPrice);

        boolean[] result = new boolean[table.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = node.operator().test(left[i], right[i]);
        }
        return result;
    }

    // ========== Expressions ==========

    /**
     * Evaluate an expression to a bar-aligned series; NaN marks bars without a value.
     */
    public double[] evaluateExpression(AstNode node, IndicatorTable table, double entryPrice) {
        int n = table.size();
        if (node instanceof AstNode.Value v) {
            return Series.constant(n, v.value());
        }
        if (node instanceof AstNode.Variable v) {
            return variable(v.name(), table, entryPrice);
        }
        if (node instanceof AstNode.IndicatorCall call) {
            return indicator(call, table);
        }
        if (node instanceof AstNode.Arithmetic a) {
            double[] left = evaluateExpression(a.left(), table, entryPrice);
            double[] right = evaluateExpression(a.right(), table, entryPrice);
            double[] result = new double[n];
            for (int i = 0; i < n; i++) {
                result[i] = a.operator().apply(left[i], right[i]);
            }
            return result;
        }
        throw new EvaluationException("Not a value expression: " + node);
    }

    private double[] variable(String name, IndicatorTable table, double entryPrice) {
        List<Bar> bars = table.bars();
        return switch (name) {
            case "price", "close" -> Series.of(bars, Bar::close);
            case "open" -> Series.of(bars, Bar::open);
            case "high" -> Series.of(bars, Bar::high);
            case "low" -> Series.of(bars, Bar::low);
            case "volume" -> Series.of(bars, Bar::volume);
            case "entry_price" -> Series.constant(table.size(), entryPrice);
            default -> Series.undefined(table.size());
        };
    }

    private double[] indicator(AstNode.IndicatorCall call, IndicatorTable table) {
        Optional<IndicatorKey> key = IndicatorKey.resolve(call.kind(), call.numericArguments());
        if (key.isEmpty()) {
            log.debug("{}() called without a period, no value", call.kind().dslName());
            return Series.undefined(table.size());
        }
        return table.column(key.get());
    }

    // ========== Boolean helpers ==========

    private static boolean[] not(boolean[] values) {
        boolean[] result = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = !values[i];
        }
        return result;
    }

    private static boolean[] combine(LogicalOperator op, boolean[] left, boolean[] right) {
        boolean[] result = new boolean[left.length];
        for (int i = 0; i < left.length; i++) {
            result[i] = op == LogicalOperator.AND ? left[i] && right[i] : left[i] || right[i];
        }
        return result;
    }

    public static class EvaluationException extends RuntimeException {
        public EvaluationException(String message) {
            super(message);
        }
    }
}
