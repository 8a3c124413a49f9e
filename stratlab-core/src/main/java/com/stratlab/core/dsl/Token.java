package com.stratlab.core.dsl;

/**
 * Token produced by the lexer. {@code position} is the offset of the token's
 * first character in the rules string.
 */
public record Token(TokenType type, String value, int position) {}
