package com.whitehall.core.parser;

import com.whitehall.core.ast.SourcePosition;
import com.whitehall.core.diagnostic.SyntaxError;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Read position shared by the declaration, markup and expression parsers.
 *
 * <p>Code is read token by token through the {@link Lexer}; markup is read character by
 * character. Both views advance the same offset, so the parsers can hand control back and forth
 * at any point.
 */
final class SourceCursor {

    private final Lexer lexer;
    private final String source;
    private int pos;

    SourceCursor(Lexer lexer) {
        this.lexer = lexer;
        this.source = lexer.source();
    }

    int pos() {
        return pos;
    }

    void reset(int offset) {
        this.pos = offset;
    }

    String source() {
        return source;
    }

    String fileName() {
        return lexer.fileName();
    }

    Lexer lexer() {
        return lexer;
    }

    // ---- token view ----

    Token peek() {
        return lexer.scan(pos);
    }

    Token tokenAfter(Token token) {
        return lexer.scan(token.end());
    }

    Token next() {
        Token token = peek();
        pos = token.end();
        return token;
    }

    boolean accept(String text) {
        if (peek().is(text)) {
            next();
            return true;
        }
        return false;
    }

    Token expect(String text, String what) {
        Token token = peek();
        if (!token.is(text)) {
            throw error(token, "Expected " + what + " but found " + token.describe());
        }
        return next();
    }

    Token expectIdentifier(String what) {
        Token token = peek();
        if (!token.isIdentifier()) {
            throw error(token, "Expected " + what + " but found " + token.describe());
        }
        return next();
    }

    /**
     * Skips a balanced bracket group starting at the current opening token.
     *
     * @param open opening bracket
     * @param close closing bracket
     * @return the closing token
     */
    Token skipBalanced(String open, String close) {
        Token first = expect(open, "'" + open + "'");
        int depth = 1;
        while (true) {
            Token token = next();
            if (token.isEof()) {
                throw error(first, "Unterminated '" + open + "'");
            }
            if (token.is(open)) {
                depth++;
            } else if (token.is(close)) {
                depth--;
                if (depth == 0) {
                    return token;
                }
            }
        }
    }

    /**
     * Reads type text such as {@code List<Map<String, Int>>?} or {@code (Int) -> Unit}.
     *
     * <p>Reading stops before a terminator at bracket depth zero, before a token on a new line, or
     * at end of input.
     *
     * @param terminators tokens that end the type
     * @return the type text, or null if no token was read
     */
    String readTypeText(Set<String> terminators) {
        int depth = 0;
        Token first = null;
        Token last = null;
        while (true) {
            Token token = peek();
            if (token.isEof()) {
                break;
            }
            boolean operator = token.type() == TokenType.OPERATOR;
            if (depth == 0 && first != null && token.newlineBefore() && !token.is("->")) {
                break;
            }
            if (depth == 0 && operator && terminators.contains(token.text())) {
                break;
            }
            if (depth == 0 && last != null && token.isIdentifier() && last.isIdentifier() && !last.is("suspend")) {
                break;
            }
            if (operator && (token.is("<") || token.is("(") || token.is("["))) {
                depth++;
            } else if (operator && (token.is(">") || token.is(")") || token.is("]"))) {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            if (first == null) {
                first = token;
            }
            last = next();
        }
        return first == null ? null : source.substring(first.start(), last.end());
    }

    // ---- character view ----

    boolean atEnd() {
        return pos >= source.length();
    }

    char current() {
        return source.charAt(pos);
    }

    boolean lookingAt(String text) {
        return source.startsWith(text, pos);
    }

    void advance(int count) {
        pos += count;
    }

    void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    void skipTrivia() {
        pos = lexer.skipTrivia(pos);
    }

    /**
     * Whether the cursor is at a markup tag opening such as {@code <Column}.
     *
     * @return true when {@code <} is directly followed by a letter
     */
    boolean atTagOpen() {
        return pos + 1 < source.length()
            && source.charAt(pos) == '<'
            && Character.isLetter(source.charAt(pos + 1));
    }

    SourcePosition position() {
        return lexer.positionOf(pos);
    }

    SourcePosition positionOf(int offset) {
        return lexer.positionOf(offset);
    }

    SyntaxError error(Token token, String message) {
        return new SyntaxError(fileName(), token.position(), message);
    }

    SyntaxError error(int offset, String message) {
        return new SyntaxError(fileName(), positionOf(offset), message);
    }

    /**
     * Splits text at commas that are not nested in brackets or strings.
     *
     * @param text comma separated text
     * @return trimmed, non-empty parts
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean inString = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '(', '[', '{', '<' -> depth++;
                case ')', ']', '}' -> depth--;
                case '>' -> {
                    if (i == 0 || text.charAt(i - 1) != '-') {
                        depth--;
                    }
                }
                case ',' -> {
                    if (depth == 0) {
                        parts.add(text.substring(start, i).trim());
                        start = i + 1;
                    }
                }
                default -> {
                    // other characters carry no structure
                }
            }
        }
        parts.add(text.substring(start).trim());
        return parts.stream().filter(p -> !p.isEmpty()).toList();
    }
}
