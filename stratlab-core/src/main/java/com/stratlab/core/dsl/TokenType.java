package com.stratlab.core.dsl;

/**
 * Token types for the rule lexer
 */
public enum TokenType {
    CONDITION,      // rsi(14) < 30, price > sma(200)
    LOGICAL         // AND, OR, NOT
}
