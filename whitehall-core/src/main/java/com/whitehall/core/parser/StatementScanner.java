package com.whitehall.core.parser;

import com.whitehall.core.ast.CodeBlock;
import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Dispatcher;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.MemberAccess;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Finds rewritable statements inside verbatim code blocks.
 *
 * <p>Function bodies are kept as text. Only two statement shapes need rewriting in them: writes to
 * state ({@code name = value}, {@code a.b += 1}, {@code count++}) and dispatch blocks
 * ({@code io { ... }}). The scanner locates those by token and parses just the matched statements,
 * leaving everything else untouched.
 */
public final class StatementScanner {

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=", "*=", "/=", "%=");
    private static final Set<String> STATEMENT_BOUNDARIES = Set.of("{", "}", ";", "->", ")", "else");

    private StatementScanner() {
        // Utility class - no instantiation
    }

    /**
     * A parsed statement and the character range it occupies in the block text.
     *
     * @param start offset of the first character
     * @param end offset after the last character
     * @param statement parsed statement
     */
    public record Span(int start, int end, ExprNode statement) {}

    /**
     * A dispatch keyword at the start of a statement.
     *
     * @param start offset of the keyword
     * @param end offset after the keyword
     * @param dispatcher selected dispatcher
     */
    public record DispatchSite(int start, int end, Dispatcher dispatcher) {}

    /**
     * Finds assignment and increment statements whose target the predicate accepts.
     *
     * @param block verbatim code
     * @param fileName file name for diagnostics
     * @param target accepts the targets worth rewriting
     * @return matched statements in source order
     */
    public static List<Span> assignments(CodeBlock block, String fileName, Predicate<ExprNode> target) {
        Lexer lexer = new Lexer(block.text(), fileName, block.start());
        SourceCursor cursor = new SourceCursor(lexer);
        ExpressionParser parser = new ExpressionParser(cursor);
        List<Span> spans = new ArrayList<>();

        Token previous = null;
        boolean afterSpan = false;
        int pos = 0;
        while (true) {
            Token token = lexer.scan(pos);
            if (token.isEof()) {
                break;
            }
            if (afterSpan || statementStart(previous, token)) {
                ExprNode matched = matchTarget(lexer, token);
                if (matched != null && target.test(matched)) {
                    cursor.reset(token.start());
                    ExprNode statement = parser.parseStatement();
                    spans.add(new Span(token.start(), cursor.pos(), statement));
                    pos = cursor.pos();
                    afterSpan = true;
                    continue;
                }
            }
            afterSpan = false;
            previous = token;
            pos = token.end();
        }
        return spans;
    }

    /**
     * Finds {@code io}, {@code cpu} and {@code main} blocks.
     *
     * @param block verbatim code
     * @param fileName file name for diagnostics
     * @return dispatch keywords in source order
     */
    public static List<DispatchSite> dispatchSites(CodeBlock block, String fileName) {
        Lexer lexer = new Lexer(block.text(), fileName, block.start());
        List<DispatchSite> sites = new ArrayList<>();
        Token previous = null;
        int pos = 0;
        while (true) {
            Token token = lexer.scan(pos);
            if (token.isEof()) {
                break;
            }
            Dispatcher dispatcher = token.isIdentifier() ? Dispatcher.fromKeyword(token.text()) : null;
            if (dispatcher != null && (previous == null || !(previous.is(".") || previous.is("fun")))) {
                Token next = lexer.scan(token.end());
                if (next.is("{") && !next.newlineBefore()) {
                    sites.add(new DispatchSite(token.start(), token.end(), dispatcher));
                }
            }
            previous = token;
            pos = token.end();
        }
        return sites;
    }

    private static boolean statementStart(Token previous, Token token) {
        if (previous == null) {
            return true;
        }
        // Named arguments split over lines look like assignments
        if (previous.is("(") || previous.is(",")) {
            return false;
        }
        return token.newlineBefore() || STATEMENT_BOUNDARIES.stream().anyMatch(previous::is);
    }

    /**
     * Matches {@code a.b.c op}, {@code a.b++} or {@code ++a.b} and returns the target.
     */
    private static ExprNode matchTarget(Lexer lexer, Token first) {
        boolean prefix = first.is("++") || first.is("--");
        Token token = prefix ? lexer.scan(first.end()) : first;
        if (!token.isIdentifier() || isKeyword(token)) {
            return null;
        }
        ExprNode target = new Identifier(token.text());
        Token next = lexer.scan(token.end());
        while (next.is(".")) {
            Token member = lexer.scan(next.end());
            if (!member.isIdentifier()) {
                return null;
            }
            target = new MemberAccess(target, member.text(), false);
            next = lexer.scan(member.end());
        }
        if (prefix) {
            return target;
        }
        if (next.type() == TokenType.OPERATOR && !next.newlineBefore()
            && (ASSIGNMENT_OPERATORS.contains(next.text()) || next.is("++") || next.is("--"))) {
            return target;
        }
        return null;
    }

    private static boolean isKeyword(Token token) {
        return switch (token.text()) {
            case "val", "var", "fun", "return", "if", "else", "when", "for", "while", "do", "throw", "try" -> true;
            default -> false;
        };
    }
}
