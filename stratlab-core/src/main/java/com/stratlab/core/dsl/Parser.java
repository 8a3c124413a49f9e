package com.stratlab.core.dsl;

import com.stratlab.core.indicators.IndicatorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the rule language.
 *
 * Grammar (informal, no grouping and no precedence):
 * rules       = condition ( LOGICAL condition? )*
 * condition   = expression COMPARISON expression      split at the first operator found
 * expression  = number
 *             | name "(" args ")"                     name is a known indicator
 *             | variable
 *             | expression ARITHMETIC expression      tried at every occurrence, "*" "/" "+" "-"
 */
public class Parser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern FUNCTION_CALL = Pattern.compile("(\\w+)\\(([^()]*)\\)");
    private static final Pattern IDENTIFIER = Pattern.compile("\\w+");

    public static final Set<String> VARIABLES = Set.of(
        "price", "open", "high", "low", "close", "volume", "entry_price"
    );

    /**
     * Parse a rules string without throwing. A blank string parses to an empty
     * node list.
     */
    public ParseResult parse(String rules) {
        try {
            return new ParseResult(true, parseRules(rules), null, null);
        } catch (ParserException e) {
            return new ParseResult(false, List.of(), e.getMessage(), e.fragment());
        }
    }

    /**
     * Parse a rules string into its flat node list.
     *
     * @throws ParserException naming the condition that failed
     */
    public List<AstNode> parseRules(String rules) {
        List<AstNode> nodes = new ArrayList<>();

        for (Token token : Lexer.tokenize(rules)) {
            switch (token.type()) {
                case LOGICAL -> nodes.add(new AstNode.Operator(LogicalOperator.valueOf(token.value())));
                case CONDITION -> {
                    try {
                        nodes.add(parseCondition(token.value()));
                    } catch (ParserException e) {
                        throw new ParserException(
                            "Error parsing condition '" + token.value() + "': " + e.getMessage(),
                            e.fragment(), e);
                    }
                }
            }
        }

        return nodes;
    }

    /**
     * Parse a single condition such as {@code rsi(14) < 30}.
     */
    public AstNode.Comparison parseCondition(String condition) {
        String text = condition.trim();

        for (ComparisonOperator op : ComparisonOperator.values()) {
            int index = text.indexOf(op.symbol());
            if (index >= 0) {
                String left = text.substring(0, index);
                String right = text.substring(index + op.symbol().length());
                return new AstNode.Comparison(op, parseExpression(left), parseExpression(right));
            }
        }

        throw new ParserException("Invalid condition: " + text, text);
    }

    /**
     * Parse an expression (number, indicator call, variable, or arithmetic).
     */
    public AstNode parseExpression(String expression) {
        String expr = expression.trim();

        if (NUMBER.matcher(expr).matches()) {
            return new AstNode.Value(Double.parseDouble(expr));
        }

        Matcher call = FUNCTION_CALL.matcher(expr);
        if (call.matches()) {
            return indicatorCall(call.group(1), call.group(2), expr);
        }

        String lower = expr.toLowerCase(Locale.ROOT);
        if (VARIABLES.contains(lower)) {
            return new AstNode.Variable(lower);
        }

        ParserException cause = null;
        for (ArithmeticOperator op : ArithmeticOperator.values()) {
            int index = expr.indexOf(op.symbol());
            while (index >= 0) {
                try {
                    AstNode left = parseExpression(expr.substring(0, index));
                    AstNode right = parseExpression(expr.substring(index + 1));
                    return new AstNode.Arithmetic(op, left, right);
                } catch (ParserException e) {
                    if (cause == null || e.isSpecific()) {
                        cause = e;
                    }
                }
                index = expr.indexOf(op.symbol(), index + 1);
            }
        }

        if (count(expr, '(') != count(expr, ')')) {
            throw new ParserException("Unmatched function-call syntax: " + expr, expr, true);
        }
        if (cause != null && cause.isSpecific()) {
            throw new ParserException("Invalid expression: " + expr + " (" + cause.getMessage() + ")",
                cause.fragment(), cause, true);
        }
        throw new ParserException("Invalid expression: " + (expr.isEmpty() ? "<empty>" : expr), expr);
    }

    private AstNode.IndicatorCall indicatorCall(String name, String argsText, String expr) {
        String lowerName = name.toLowerCase(Locale.ROOT);
        IndicatorKind kind = IndicatorKind.fromDslName(lowerName);
        if (kind == null) {
            throw new ParserException("Unknown indicator: " + lowerName, expr, true);
        }

        List<AstNode.Argument> arguments = new ArrayList<>();
        if (!argsText.isBlank()) {
            for (String part : argsText.split(",", -1)) {
                String arg = part.trim();
                if (NUMBER.matcher(arg).matches()) {
                    arguments.add(new AstNode.Argument.Number(Double.parseDouble(arg)));
                } else if (IDENTIFIER.matcher(arg).matches()) {
                    arguments.add(new AstNode.Argument.Symbol(arg.toLowerCase(Locale.ROOT)));
                } else {
                    throw new ParserException("Malformed numeric literal '" + arg + "' in " + expr, expr, true);
                }
            }
        }

        return new AstNode.IndicatorCall(kind, arguments);
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) n++;
        }
        return n;
    }

    // ========== Result Types ==========

    /**
     * Result of parsing a rules string. On failure {@code fragment} holds the
     * offending part of the input.
     */
    public record ParseResult(boolean success, List<AstNode> nodes, String error, String fragment) {}

    /**
     * Exception thrown during parsing
     */
    public static class ParserException extends RuntimeException {
        private final String fragment;
        private final boolean specific;

        public ParserException(String message, String fragment) {
            this(message, fragment, false);
        }

        ParserException(String message, String fragment, boolean specific) {
            super(message);
            this.fragment = fragment;
            this.specific = specific;
        }

        ParserException(String message, String fragment, Throwable cause) {
            this(message, fragment, cause, isSpecific(cause));
        }

        ParserException(String message, String fragment, Throwable cause, boolean specific) {
            super(message, cause);
            this.fragment = fragment;
            this.specific = specific;
        }

        /**
         * The part of the rules string that could not be parsed.
         */
        public String fragment() {
            return fragment;
        }

        private static boolean isSpecific(Throwable cause) {
            return cause instanceof ParserException p && p.specific;
        }

        /**
         * True for failures that name a concrete problem (unknown indicator,
         * malformed literal, unbalanced parentheses) rather than a shape mismatch.
         */
        boolean isSpecific() {
            return specific;
        }
    }
}
