package com.whitehall.core.parser;

import com.whitehall.core.ast.ControlDirective;
import com.whitehall.core.ast.ControlDirective.Branch;
import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Segment;
import com.whitehall.core.ast.ExprNode.StringInterpolation;
import com.whitehall.core.ast.MarkupChild;
import com.whitehall.core.ast.MarkupNode;
import com.whitehall.core.ast.PropValue;
import com.whitehall.core.ast.SourcePosition;
import com.whitehall.core.ast.TextSegment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses markup trees: tags, props, text with {@code {expr}} interpolation and the
 * {@code @if}, {@code @for} and {@code @when} directives.
 *
 * <p>Markup is read character by character; every embedded expression is handed to the
 * {@link ExpressionParser} at the current offset.
 */
final class MarkupParser {

    private final SourceCursor cursor;
    private final ExpressionParser expressions;

    MarkupParser(SourceCursor cursor, ExpressionParser expressions) {
        this.cursor = cursor;
        this.expressions = expressions;
    }

    /**
     * Parses one element; the cursor must be at its {@code <}.
     *
     * @return element node
     */
    MarkupNode parseElement() {
        int start = cursor.pos();
        SourcePosition position = cursor.position();
        cursor.advance(1);
        String tag = readName(true);
        Map<String, PropValue> props = new LinkedHashMap<>();

        while (true) {
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                throw cursor.error(start, "Unterminated tag <" + tag + ">");
            }
            if (cursor.lookingAt("/>")) {
                cursor.advance(2);
                return new MarkupNode(tag, props, List.of(), position);
            }
            if (cursor.current() == '>') {
                cursor.advance(1);
                break;
            }
            int propStart = cursor.pos();
            String name = readName(false);
            if (name.isEmpty()) {
                throw cursor.error(propStart, "Unexpected character '" + cursor.current() + "' in tag <" + tag + ">");
            }
            if (props.containsKey(name)) {
                throw cursor.error(propStart, "Duplicate prop '" + name + "' on <" + tag + ">");
            }
            cursor.skipWhitespace();
            if (!cursor.atEnd() && cursor.current() == '=') {
                cursor.advance(1);
                cursor.skipWhitespace();
                props.put(name, parsePropValue(tag, name));
            } else {
                props.put(name, new PropValue.Literal(Boolean.TRUE));
            }
        }

        List<MarkupChild> children = parseChildren(tag, start);
        return new MarkupNode(tag, props, children, position);
    }

    /**
     * True when the cursor is at an element or an {@code @if}, {@code @for} or {@code @when} directive.
     */
    boolean atRootStart() {
        return cursor.atTagOpen() || atDirective("if") || atDirective("for") || atDirective("when");
    }

    /**
     * Parses one root of a composable body; the cursor must satisfy {@link #atRootStart()}.
     *
     * @return element or directive
     */
    MarkupChild parseRoot() {
        if (cursor.atTagOpen()) {
            return parseElement();
        }
        if (atDirective("if")) {
            return parseIf();
        }
        if (atDirective("for")) {
            return parseFor();
        }
        if (atDirective("when")) {
            return parseWhen();
        }
        throw cursor.error(cursor.pos(), "Expected markup or a directive");
    }

    private PropValue parsePropValue(String tag, String name) {
        int valueStart = cursor.pos();
        if (cursor.atEnd()) {
            throw cursor.error(valueStart, "Missing value for prop '" + name + "' on <" + tag + ">");
        }
        char c = cursor.current();
        if (c == '"') {
            cursor.advance(1);
            StringInterpolation text = readText("\"", valueStart, false);
            cursor.advance(1);
            if (!text.hasExpressions()) {
                return new PropValue.Literal(text.segments().isEmpty() ? "" : text.segments().get(0).text());
            }
            return new PropValue.Expression(text);
        }
        if (c != '{') {
            throw cursor.error(valueStart, "Expected '\"' or '{' for prop '" + name + "' on <" + tag + ">");
        }
        cursor.advance(1);
        cursor.skipWhitespace();
        PropValue value;
        if (cursor.atTagOpen()) {
            value = new PropValue.Markup(parseElement());
        } else {
            ExprNode expr = expressions.parseExpression();
            value = expr instanceof ExprNode.Lambda lambda
                ? new PropValue.Lambda(lambda)
                : new PropValue.Expression(expr);
        }
        Token close = cursor.peek();
        if (!close.is("}")) {
            throw cursor.error(close, "Unparseable expression for prop '" + name + "' on <" + tag
                + ">: expected '}' but found " + close.describe());
        }
        cursor.next();
        return value;
    }

    /**
     * Parses children up to the matching close tag.
     */
    private List<MarkupChild> parseChildren(String tag, int tagStart) {
        List<MarkupChild> children = new ArrayList<>();
        while (true) {
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                throw cursor.error(tagStart, "Unterminated tag <" + tag + ">");
            }
            if (cursor.lookingAt("</")) {
                int closeStart = cursor.pos();
                cursor.advance(2);
                String closing = readName(true);
                cursor.skipWhitespace();
                if (cursor.atEnd() || cursor.current() != '>') {
                    throw cursor.error(closeStart, "Malformed closing tag </" + closing);
                }
                cursor.advance(1);
                if (!closing.equals(tag)) {
                    throw cursor.error(closeStart, "Mismatched closing tag </" + closing + ">, expected </" + tag + ">");
                }
                return children;
            }
            if (cursor.current() == '}' && !cursor.lookingAt("}}")) {
                throw cursor.error(cursor.pos(), "Unexpected '}' inside <" + tag + ">");
            }
            parseChild(children);
        }
    }

    /**
     * Parses the children of a directive block; the opening brace is already consumed.
     *
     * @param blockStart offset of the opening brace
     * @return children up to and including the closing brace
     */
    private List<MarkupChild> parseBlock(int blockStart) {
        List<MarkupChild> children = new ArrayList<>();
        while (true) {
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                throw cursor.error(blockStart, "Unterminated directive block");
            }
            if (cursor.current() == '}') {
                cursor.advance(1);
                return children;
            }
            if (cursor.lookingAt("</")) {
                throw cursor.error(cursor.pos(), "Unexpected closing tag inside directive block");
            }
            parseChild(children);
        }
    }

    private void parseChild(List<MarkupChild> children) {
        if (cursor.lookingAt("<!--")) {
            int close = cursor.source().indexOf("-->", cursor.pos());
            if (close < 0) {
                throw cursor.error(cursor.pos(), "Unterminated comment");
            }
            cursor.reset(close + 3);
        } else if (cursor.atTagOpen()) {
            children.add(parseElement());
        } else if (atDirective("if")) {
            children.add(parseIf());
        } else if (atDirective("for")) {
            children.add(parseFor());
        } else if (atDirective("when")) {
            children.add(parseWhen());
        } else {
            int start = cursor.pos();
            StringInterpolation text = readText(null, start, true);
            if (!text.segments().isEmpty()) {
                children.add(new TextSegment(text, cursor.positionOf(start)));
            } else if (cursor.pos() == start) {
                throw cursor.error(start, "Unexpected character '" + cursor.current() + "'");
            }
        }
    }

    private boolean atMarkupOpen() {
        return cursor.atTagOpen() || cursor.lookingAt("</") || cursor.lookingAt("<!--");
    }

    private boolean atDirective(String keyword) {
        String directive = "@" + keyword;
        if (!cursor.lookingAt(directive)) {
            return false;
        }
        int after = cursor.pos() + directive.length();
        return after >= cursor.source().length() || !Lexer.isIdentifierPart(cursor.source().charAt(after));
    }

    private ControlDirective.If parseIf() {
        SourcePosition position = cursor.position();
        List<Branch> branches = new ArrayList<>();
        cursor.advance(3);
        branches.add(new Branch(parseParenthesized("@if"), parseDirectiveBody("@if")));

        while (true) {
            int save = cursor.pos();
            cursor.skipWhitespace();
            if (!consumeKeyword("@else") && !consumeKeyword("else")) {
                cursor.reset(save);
                break;
            }
            cursor.skipWhitespace();
            if (consumeKeyword("@if") || consumeKeyword("if")) {
                branches.add(new Branch(parseParenthesized("else if"), parseDirectiveBody("else if")));
            } else {
                branches.add(new Branch(null, parseDirectiveBody("else")));
                break;
            }
        }
        return new ControlDirective.If(branches, position);
    }

    private ControlDirective.For parseFor() {
        SourcePosition position = cursor.position();
        cursor.advance(4);
        cursor.expect("(", "'(' after @for");
        String first = cursor.expectIdentifier("loop variable").text();
        String indexVar = null;
        String loopVar = first;
        if (cursor.accept(",")) {
            indexVar = first;
            loopVar = cursor.expectIdentifier("loop variable").text();
        }
        cursor.expect("in", "'in' in @for");
        ExprNode iterable = expressions.parseExpression();
        ExprNode keySelector = null;
        if (cursor.accept(",")) {
            cursor.expect("key", "'key' in @for");
            cursor.expect("=", "'=' after key");
            keySelector = expressions.parseExpression();
        }
        cursor.expect(")", "')' to close @for");
        List<MarkupChild> body = parseDirectiveBody("@for");

        List<MarkupChild> emptyBody = List.of();
        int save = cursor.pos();
        cursor.skipWhitespace();
        if (consumeKeyword("empty")) {
            emptyBody = parseDirectiveBody("empty");
        } else {
            cursor.reset(save);
        }
        return new ControlDirective.For(indexVar, loopVar, iterable, keySelector, body, emptyBody, position);
    }

    private ControlDirective.When parseWhen() {
        SourcePosition position = cursor.position();
        cursor.advance(5);
        ExprNode subject = null;
        if (cursor.peek().is("(")) {
            subject = parseParenthesized("@when");
        }
        Token open = cursor.expect("{", "'{' after @when");
        List<Branch> branches = new ArrayList<>();
        while (true) {
            Token token = cursor.peek();
            if (token.is("}")) {
                cursor.next();
                break;
            }
            if (token.isEof()) {
                throw cursor.error(open, "Unterminated @when");
            }
            List<ExprNode> conditions = new ArrayList<>();
            if (token.is("else")) {
                cursor.next();
            } else {
                do {
                    conditions.add(expressions.parseExpression());
                } while (cursor.accept(","));
            }
            cursor.expect("->", "'->' in @when branch");
            cursor.skipWhitespace();
            List<MarkupChild> body;
            if (cursor.atTagOpen()) {
                body = List.of(parseElement());
            } else if (!cursor.atEnd() && cursor.current() == '{') {
                int blockStart = cursor.pos();
                cursor.advance(1);
                body = parseBlock(blockStart);
            } else {
                throw cursor.error(cursor.pos(), "Expected markup or '{' after '->' in @when");
            }
            branches.add(conditions.isEmpty()
                ? new Branch(null, body)
                : new Branch(conditions.get(0), conditions.subList(1, conditions.size()), body));
        }
        return new ControlDirective.When(subject, branches, position);
    }

    private ExprNode parseParenthesized(String directive) {
        cursor.expect("(", "'(' after " + directive);
        ExprNode condition = expressions.parseExpression();
        cursor.expect(")", "')' after " + directive + " condition");
        return condition;
    }

    private List<MarkupChild> parseDirectiveBody(String directive) {
        Token open = cursor.expect("{", "'{' after " + directive);
        return parseBlock(open.start());
    }

    private boolean consumeKeyword(String keyword) {
        if (!cursor.lookingAt(keyword)) {
            return false;
        }
        int after = cursor.pos() + keyword.length();
        if (after < cursor.source().length() && Lexer.isIdentifierPart(cursor.source().charAt(after))) {
            return false;
        }
        cursor.advance(keyword.length());
        return true;
    }

    /**
     * Reads text with {@code {expr}} interpolation. Doubled braces are literal braces.
     *
     * @param terminator closing quote for prop values, or null for child text
     * @param start offset used for error reporting
     * @param collapse whether runs of whitespace collapse to one space and the ends are trimmed
     * @return the text; segments are empty for whitespace-only text
     */
    private StringInterpolation readText(String terminator, int start, boolean collapse) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (true) {
            if (cursor.atEnd()) {
                if (terminator != null) {
                    throw cursor.error(start, "Unterminated string value");
                }
                break;
            }
            char c = cursor.current();
            if (terminator != null && cursor.lookingAt(terminator)) {
                break;
            }
            if (terminator == null && (atMarkupOpen() || atDirective("if") || atDirective("for") || atDirective("when"))) {
                break;
            }
            if (cursor.lookingAt("{{") || cursor.lookingAt("}}")) {
                text.append(c);
                cursor.advance(2);
            } else if (c == '{') {
                appendText(text, segments, collapse);
                cursor.advance(1);
                segments.add(Segment.expr(expressions.parseExpression()));
                Token close = cursor.peek();
                if (!close.is("}")) {
                    throw cursor.error(close, "Expected '}' to close interpolation but found " + close.describe());
                }
                cursor.next();
            } else if (c == '}') {
                break;
            } else {
                text.append(c);
                cursor.advance(1);
            }
        }
        appendText(text, segments, collapse);
        if (collapse) {
            trimEnds(segments);
        }
        return new StringInterpolation(segments);
    }

    private static void appendText(StringBuilder text, List<Segment> segments, boolean collapse) {
        if (text.length() == 0) {
            return;
        }
        String value = collapse ? text.toString().replaceAll("\\s+", " ") : text.toString();
        segments.add(Segment.text(value));
        text.setLength(0);
    }

    private static void trimEnds(List<Segment> segments) {
        if (!segments.isEmpty() && segments.get(0).isText()) {
            String trimmed = segments.get(0).text().stripLeading();
            segments.remove(0);
            if (!trimmed.isEmpty()) {
                segments.add(0, Segment.text(trimmed));
            }
        }
        int last = segments.size() - 1;
        if (last >= 0 && segments.get(last).isText()) {
            String trimmed = segments.get(last).text().stripTrailing();
            segments.remove(last);
            if (!trimmed.isEmpty()) {
                segments.add(Segment.text(trimmed));
            }
        }
    }

    private String readName(boolean tag) {
        int start = cursor.pos();
        while (!cursor.atEnd()) {
            char c = cursor.current();
            boolean allowed = Lexer.isIdentifierPart(c) || (tag ? c == '.' : c == ':' || c == '-');
            if (!allowed) {
                break;
            }
            cursor.advance(1);
        }
        return cursor.source().substring(start, cursor.pos());
    }
}
