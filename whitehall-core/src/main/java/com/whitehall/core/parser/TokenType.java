package com.whitehall.core.parser;

/**
 * Token categories produced by {@link Lexer}.
 */
public enum TokenType {
    /** Names and keywords; may start with {@code $} */
    IDENTIFIER,
    NUMBER,
    /** Double-quoted or triple-quoted string, quotes included */
    STRING,
    /** Single-quoted character literal, quotes included */
    CHAR,
    /** Punctuation and operators */
    OPERATOR,
    EOF
}
