package com.whitehall.core.parser;

import com.whitehall.core.ast.SourcePosition;
import com.whitehall.core.diagnostic.SyntaxError;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * On-demand tokenizer for the code parts of a source file.
 *
 * <p>Markup is context sensitive, so the lexer does not pre-tokenize the file. The parser asks
 * for the token starting at a given offset instead, and reads markup text directly from the
 * characters. Whitespace and comments before a token are skipped, and a line break among them
 * sets {@link Token#newlineBefore()}. Results are cached per offset, so backtracking is cheap.
 *
 * <p>String literals are scanned as a single token, including nested {@code ${...}} templates,
 * so braces inside strings never unbalance brace matching.
 */
public final class Lexer {

    private static final List<String> OPERATORS = List.of(
        "===", "!==", "..<", "?.", "?:", "!!", "..", "->", "=>", "==", "!=", "<=", ">=", "&&", "||",
        "++", "--", "+=", "-=", "*=", "/=", "%=", "::",
        "+", "-", "*", "/", "%", "=", "<", ">", "!", "?", ":", ".", ",", ";",
        "(", ")", "[", "]", "{", "}", "@", "&", "|", "#", "~"
    );

    private final String source;
    private final String fileName;
    private final LineMap lineMap;
    private final Map<Integer, Token> cache = new HashMap<>();

    public Lexer(String source, String fileName) {
        this(source, fileName, new LineMap(source));
    }

    /**
     * Creates a lexer for a fragment of a larger file, reporting positions relative to that file.
     *
     * @param fragment fragment text
     * @param fileName enclosing file name
     * @param start position of the fragment's first character in the enclosing file
     */
    public Lexer(String fragment, String fileName, SourcePosition start) {
        this(fragment, fileName, new LineMap(fragment, start.line(), start.column()));
    }

    private Lexer(String source, String fileName, LineMap lineMap) {
        this.source = source;
        this.fileName = fileName;
        this.lineMap = lineMap;
    }

    public String source() {
        return source;
    }

    public String fileName() {
        return fileName;
    }

    public SourcePosition positionOf(int offset) {
        return lineMap.positionOf(Math.min(offset, source.length()));
    }

    /**
     * Returns the token that starts at or after {@code offset}, skipping whitespace and comments.
     *
     * @param offset character offset
     * @return next token; an EOF token at the end of input
     */
    public Token scan(int offset) {
        Token cached = cache.get(offset);
        if (cached != null) {
            return cached;
        }
        Token token = scanUncached(offset);
        cache.put(offset, token);
        return token;
    }

    /**
     * Returns the offset of the first character after whitespace and comments.
     *
     * @param offset starting offset
     * @return offset of the next significant character
     */
    public int skipTrivia(int offset) {
        int i = offset;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (source.startsWith("//", i)) {
                while (i < source.length() && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (source.startsWith("/*", i)) {
                int close = source.indexOf("*/", i + 2);
                if (close < 0) {
                    throw new SyntaxError(fileName, positionOf(i), "Unterminated block comment");
                }
                i = close + 2;
            } else {
                break;
            }
        }
        return i;
    }

    private Token scanUncached(int offset) {
        int start = skipTrivia(offset);
        boolean newline = source.substring(offset, start).indexOf('\n') >= 0;
        if (start >= source.length()) {
            return new Token(TokenType.EOF, "", start, start, positionOf(start), newline);
        }

        char c = source.charAt(start);
        int end;
        TokenType type;
        if (isIdentifierStart(c)) {
            end = start + 1;
            while (end < source.length() && isIdentifierPart(source.charAt(end))) {
                end++;
            }
            type = TokenType.IDENTIFIER;
        } else if (c == '`') {
            end = source.indexOf('`', start + 1);
            if (end < 0) {
                throw new SyntaxError(fileName, positionOf(start), "Unterminated backtick identifier");
            }
            end++;
            type = TokenType.IDENTIFIER;
        } else if (Character.isDigit(c)) {
            end = scanNumber(start);
            type = TokenType.NUMBER;
        } else if (c == '"') {
            end = skipString(start);
            type = TokenType.STRING;
        } else if (c == '\'') {
            end = scanChar(start);
            type = TokenType.CHAR;
        } else {
            String op = OPERATORS.stream()
                .filter(o -> source.startsWith(o, start))
                .findFirst()
                .orElseThrow(() -> new SyntaxError(fileName, positionOf(start),
                    "Unexpected character '" + c + "'"));
            end = start + op.length();
            type = TokenType.OPERATOR;
        }
        return new Token(type, source.substring(start, end), start, end, positionOf(start), newline);
    }

    private int scanNumber(int start) {
        int i = start;
        if (source.startsWith("0x", i) || source.startsWith("0X", i) || source.startsWith("0b", i)) {
            i += 2;
            while (i < source.length() && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                i++;
            }
            return i;
        }
        while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '_')) {
            i++;
        }
        // A dot only belongs to the number when a digit follows: 16.dp is a member access
        if (i + 1 < source.length() && source.charAt(i) == '.' && Character.isDigit(source.charAt(i + 1))) {
            i++;
            while (i < source.length() && Character.isDigit(source.charAt(i))) {
                i++;
            }
        }
        if (i < source.length() && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < source.length() && (source.charAt(j) == '+' || source.charAt(j) == '-')) {
                j++;
            }
            if (j < source.length() && Character.isDigit(source.charAt(j))) {
                i = j;
                while (i < source.length() && Character.isDigit(source.charAt(i))) {
                    i++;
                }
            }
        }
        if (i < source.length() && "fFLuU".indexOf(source.charAt(i)) >= 0) {
            i++;
        }
        return i;
    }

    private int scanChar(int start) {
        int i = start + 1;
        while (i < source.length() && source.charAt(i) != '\'') {
            if (source.charAt(i) == '\\') {
                i++;
            }
            if (i < source.length() && source.charAt(i) == '\n') {
                break;
            }
            i++;
        }
        if (i >= source.length() || source.charAt(i) != '\'') {
            throw new SyntaxError(fileName, positionOf(start), "Unterminated character literal");
        }
        return i + 1;
    }

    /**
     * Skips a string literal starting at {@code start} (the opening quote).
     *
     * @param start offset of the opening quote
     * @return offset after the closing quote
     */
    public int skipString(int start) {
        boolean triple = source.startsWith("\"\"\"", start);
        int i = start + (triple ? 3 : 1);
        while (i < source.length()) {
            char c = source.charAt(i);
            if (triple && source.startsWith("\"\"\"", i)) {
                int end = i + 3;
                while (end < source.length() && source.charAt(end) == '"') {
                    end++;
                }
                return end;
            }
            if (!triple && c == '"') {
                return i + 1;
            }
            if (!triple && c == '\n') {
                break;
            }
            if (!triple && c == '\\') {
                i += 2;
                continue;
            }
            if (c == '$' && i + 1 < source.length() && source.charAt(i + 1) == '{') {
                i = skipTemplate(i + 2);
                continue;
            }
            i++;
        }
        throw new SyntaxError(fileName, positionOf(start), "Unterminated string literal");
    }

    /**
     * Skips the expression of a {@code ${...}} template.
     *
     * @param start offset just after {@code ${}
     * @return offset after the closing brace
     */
    public int skipTemplate(int start) {
        int depth = 1;
        int i = start;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"') {
                i = skipString(i);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }
        throw new SyntaxError(fileName, positionOf(start), "Unterminated string template");
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
