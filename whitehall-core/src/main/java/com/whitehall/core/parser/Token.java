package com.whitehall.core.parser;

import com.whitehall.core.ast.SourcePosition;

/**
 * Lexical token with its source span.
 *
 * @param type token category
 * @param text exact source text
 * @param start offset of the first character
 * @param end offset after the last character
 * @param position line and column of {@code start}
 * @param newlineBefore true when a line break separates this token from the previous one
 */
public record Token(
    TokenType type,
    String text,
    int start,
    int end,
    SourcePosition position,
    boolean newlineBefore
) {

    public boolean is(String value) {
        return (type == TokenType.OPERATOR || type == TokenType.IDENTIFIER) && text.equals(value);
    }

    public boolean isIdentifier() {
        return type == TokenType.IDENTIFIER;
    }

    public boolean isEof() {
        return type == TokenType.EOF;
    }

    public String describe() {
        return isEof() ? "end of input" : "'" + text + "'";
    }
}
