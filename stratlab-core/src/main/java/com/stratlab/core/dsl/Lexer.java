package com.stratlab.core.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule lexer - splits a rules string on whitespace into condition clauses and
 * logical keywords. Consecutive non-keyword words are re-joined with single
 * spaces into one condition.
 */
public class Lexer {

    private static final Pattern WORD = Pattern.compile("\\S+");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the source string
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        tokens.clear();

        StringBuilder condition = new StringBuilder();
        int conditionStart = -1;

        Matcher matcher = WORD.matcher(source);
        while (matcher.find()) {
            String word = matcher.group();
            LogicalOperator op = LogicalOperator.fromKeyword(word);

            if (op != null) {
                if (conditionStart >= 0) {
                    tokens.add(new Token(TokenType.CONDITION, condition.toString(), conditionStart));
                    condition.setLength(0);
                    conditionStart = -1;
                }
                tokens.add(new Token(TokenType.LOGICAL, op.name(), matcher.start()));
            } else {
                if (conditionStart < 0) {
                    conditionStart = matcher.start();
                } else {
                    condition.append(' ');
                }
                condition.append(word);
            }
        }

        if (conditionStart >= 0) {
            tokens.add(new Token(TokenType.CONDITION, condition.toString(), conditionStart));
        }

        return tokens;
    }
}
