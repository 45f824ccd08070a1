package com.whitehall.core.parser;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.ArrayLiteral;
import com.whitehall.core.ast.ExprNode.Assignment;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Conditional;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.IndexAccess;
import com.whitehall.core.ast.ExprNode.Lambda;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.LiteralKind;
import com.whitehall.core.ast.ExprNode.LocalVariable;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.ExprNode.Parenthesized;
import com.whitehall.core.ast.ExprNode.Segment;
import com.whitehall.core.ast.ExprNode.StringInterpolation;
import com.whitehall.core.ast.ExprNode.Ternary;
import com.whitehall.core.ast.ExprNode.UnaryOp;
import com.whitehall.core.ast.SourcePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for expressions, lambda blocks and statements.
 *
 * <p>Precedence, lowest first: ternary, {@code ||}, {@code &&}, equality, comparison and named
 * checks ({@code in}, {@code is}), elvis, infix functions, ranges, additive, multiplicative,
 * {@code as}, prefix, postfix. Outside brackets a line break ends an expression unless the next
 * line starts with a continuation operator such as {@code .} or {@code &&}.
 */
final class ExpressionParser {

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=", "*=", "/=", "%=");
    private static final Set<String> CONTINUATIONS = Set.of(".", "?.", "?:", "&&", "||", "?", ":");
    private static final Set<String> TYPE_TOKENS = Set.of(".", ",", "?", "<", ">", "*", "(", ")", "->", ":");

    private static final List<Set<String>> BINARY_LEVELS = List.of(
        Set.of("||"),
        Set.of("&&"),
        Set.of("==", "!=", "===", "!=="),
        Set.of("<", ">", "<=", ">=", "in", "!in", "is", "!is"),
        Set.of("?:"),
        Set.of("until", "downTo", "step"),
        Set.of("..", "..<"),
        Set.of("+", "-"),
        Set.of("*", "/", "%")
    );

    private final SourceCursor cursor;

    /** Bracket depth; line breaks are insignificant while positive. */
    private int nesting;

    ExpressionParser(SourceCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Parses one expression.
     *
     * @return expression tree
     */
    ExprNode parseExpression() {
        return parseTernary();
    }

    /**
     * Parses a statement: a local {@code val}/{@code var}, an assignment or an expression.
     *
     * @return statement node
     */
    ExprNode parseStatement() {
        Token first = cursor.peek();
        if (first.is("val") || first.is("var")) {
            cursor.next();
            String name = cursor.expectIdentifier("variable name").text();
            String type = null;
            if (cursor.accept(":")) {
                type = cursor.readTypeText(Set.of("="));
            }
            cursor.expect("=", "'=' after local variable");
            return new LocalVariable(first.is("var"), name, type, parseExpression());
        }
        ExprNode expr = parseExpression();
        Token op = cursor.peek();
        if (op.type() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(op.text()) && continues(op)) {
            cursor.next();
            return new Assignment(expr, op.text(), parseExpression(), first.position());
        }
        return expr;
    }

    /**
     * Parses statements up to and including the closing brace; the opening brace is already consumed.
     *
     * @param open the opening brace, for error reporting
     * @return statements in order
     */
    List<ExprNode> parseBlock(Token open) {
        int saved = nesting;
        nesting = 0;
        List<ExprNode> statements = new ArrayList<>();
        while (true) {
            while (cursor.accept(";")) {
                // empty statement
            }
            Token token = cursor.peek();
            if (token.is("}")) {
                cursor.next();
                break;
            }
            if (token.isEof()) {
                throw cursor.error(open, "Unterminated block");
            }
            statements.add(parseStatement());
            Token after = cursor.peek();
            if (!after.is("}") && !after.is(";") && !after.newlineBefore()) {
                throw cursor.error(after, "Expected end of statement but found " + after.describe());
            }
        }
        nesting = saved;
        return statements;
    }

    private ExprNode parseTernary() {
        ExprNode condition = parseBinary(0);
        Token question = cursor.peek();
        if (question.is("?") && continues(question)) {
            cursor.next();
            ExprNode thenExpr = parseTernary();
            cursor.expect(":", "':' in conditional expression");
            ExprNode elseExpr = parseTernary();
            return new Ternary(condition, thenExpr, elseExpr);
        }
        return condition;
    }

    private ExprNode parseBinary(int level) {
        if (level == BINARY_LEVELS.size()) {
            return parseAs();
        }
        ExprNode left = parseBinary(level + 1);
        while (true) {
            Token token = cursor.peek();
            if (!continues(token)) {
                return left;
            }
            String operator = binaryOperator(token, BINARY_LEVELS.get(level));
            if (operator == null) {
                return left;
            }
            if (operator.startsWith("!") && (operator.endsWith("in") || operator.endsWith("is"))) {
                cursor.next();
            }
            cursor.next();
            ExprNode right = operator.endsWith("is") ? parseSimpleType() : parseBinary(level + 1);
            left = new BinaryOp(left, operator, right);
        }
    }

    private String binaryOperator(Token token, Set<String> operators) {
        if (token.is("!")) {
            Token after = cursor.tokenAfter(token);
            if (after.start() == token.end() && (after.is("in") || after.is("is"))
                && operators.contains("!" + after.text())) {
                return "!" + after.text();
            }
            return null;
        }
        boolean candidate = token.type() == TokenType.OPERATOR || token.isIdentifier();
        return candidate && operators.contains(token.text()) ? token.text() : null;
    }

    private ExprNode parseAs() {
        ExprNode expr = parsePrefix();
        while (cursor.peek().is("as") && continues(cursor.peek())) {
            Token as = cursor.next();
            String operator = "as";
            Token question = cursor.peek();
            if (question.is("?") && question.start() == as.end()) {
                cursor.next();
                operator = "as?";
            }
            expr = new BinaryOp(expr, operator, parseSimpleType());
        }
        return expr;
    }

    private ExprNode parsePrefix() {
        Token token = cursor.peek();
        if (token.is("!") || token.is("-") || token.is("+") || token.is("++") || token.is("--")) {
            cursor.next();
            return new UnaryOp(token.text(), parsePrefix(), false);
        }
        return parsePostfix();
    }

    private ExprNode parsePostfix() {
        ExprNode expr = parsePrimary();
        while (true) {
            Token token = cursor.peek();
            if (token.is(".") || token.is("?.")) {
                if (!continues(token)) {
                    return expr;
                }
                cursor.next();
                Token member = cursor.expectIdentifier("member name after '" + token.text() + "'");
                expr = new MemberAccess(expr, member.text(), token.is("?."));
                continue;
            }
            if (token.newlineBefore() && nesting == 0) {
                return expr;
            }
            if (token.is("(")) {
                List<Argument> arguments = parseArguments();
                expr = new Call(expr, null, arguments, parseTrailingLambda());
            } else if (token.is("<") && isCallee(expr)) {
                String typeArguments = tryTypeArguments();
                if (typeArguments == null) {
                    return expr;
                }
                List<Argument> arguments = cursor.peek().is("(") ? parseArguments() : List.of();
                expr = new Call(expr, typeArguments, arguments, parseTrailingLambda());
            } else if (token.is("{") && isCallee(expr)) {
                expr = new Call(expr, null, List.of(), parseBraceLambda());
            } else if (token.is("[")) {
                cursor.next();
                nesting++;
                ExprNode index = parseExpression();
                cursor.expect("]", "']'");
                nesting--;
                expr = new IndexAccess(expr, index);
            } else if (token.is("!!") || token.is("++") || token.is("--")) {
                cursor.next();
                expr = new UnaryOp(token.text(), expr, true);
            } else {
                return expr;
            }
        }
    }

    private boolean isCallee(ExprNode expr) {
        return expr instanceof Identifier || expr instanceof MemberAccess
            || (expr instanceof Call call && call.trailingLambda() == null);
    }

    private Lambda parseTrailingLambda() {
        Token token = cursor.peek();
        if (token.is("{") && !token.newlineBefore()) {
            return parseBraceLambda();
        }
        return null;
    }

    private List<Argument> parseArguments() {
        Token open = cursor.expect("(", "'('");
        nesting++;
        List<Argument> arguments = new ArrayList<>();
        while (!cursor.peek().is(")")) {
            if (cursor.peek().isEof()) {
                throw cursor.error(open, "Unterminated argument list");
            }
            Token token = cursor.peek();
            String name = null;
            if (token.isIdentifier() && cursor.tokenAfter(token).is("=")) {
                cursor.next();
                cursor.next();
                name = token.text();
            }
            arguments.add(new Argument(name, parseExpression()));
            if (!cursor.accept(",")) {
                break;
            }
        }
        cursor.expect(")", "')' to close argument list");
        nesting--;
        return arguments;
    }

    /**
     * Reads {@code <T, U>} after a callee when it is followed by a call.
     *
     * @return type argument text including the angle brackets, or null when {@code <} is a comparison
     */
    private String tryTypeArguments() {
        int start = cursor.pos();
        Token open = cursor.next();
        int depth = 1;
        Token token = open;
        while (depth > 0) {
            token = cursor.next();
            if (token.is("<")) {
                depth++;
            } else if (token.is(">")) {
                depth--;
            } else if (!token.isIdentifier() && !TYPE_TOKENS.contains(token.text())) {
                cursor.reset(start);
                return null;
            }
        }
        Token after = cursor.peek();
        if (!after.is("(") && !after.is("{")) {
            cursor.reset(start);
            return null;
        }
        return cursor.source().substring(open.start(), token.end());
    }

    private ExprNode parseSimpleType() {
        Token first = cursor.expectIdentifier("type name");
        Token last = first;
        while (cursor.peek().is(".") || cursor.peek().is("<")) {
            if (cursor.peek().is("<")) {
                last = cursor.skipBalanced("<", ">");
            } else {
                cursor.next();
                last = cursor.expectIdentifier("type name");
            }
        }
        Token question = cursor.peek();
        if (question.is("?") && question.start() == last.end()) {
            last = cursor.next();
        }
        return new Identifier(cursor.source().substring(first.start(), last.end()));
    }

    private ExprNode parsePrimary() {
        Token token = cursor.peek();
        switch (token.type()) {
            case NUMBER -> {
                cursor.next();
                return Literal.number(token.text());
            }
            case STRING -> {
                cursor.next();
                return parseStringLiteral(token);
            }
            case CHAR -> {
                cursor.next();
                return new Literal(LiteralKind.CHAR, token.text());
            }
            case IDENTIFIER -> {
                return parseIdentifierPrimary(token);
            }
            case EOF -> throw cursor.error(token, "Expected expression but found end of input");
            default -> {
                // operators handled below
            }
        }
        if (token.is("(")) {
            if (arrowLambdaAhead()) {
                return parseArrowLambda();
            }
            cursor.next();
            nesting++;
            ExprNode inner = parseExpression();
            cursor.expect(")", "')'");
            nesting--;
            return new Parenthesized(inner);
        }
        if (token.is("[")) {
            cursor.next();
            nesting++;
            List<ExprNode> elements = new ArrayList<>();
            while (!cursor.peek().is("]")) {
                elements.add(parseExpression());
                if (!cursor.accept(",")) {
                    break;
                }
            }
            cursor.expect("]", "']' to close array literal");
            nesting--;
            return new ArrayLiteral(elements);
        }
        if (token.is("{")) {
            return parseBraceLambda();
        }
        if (token.is("::")) {
            cursor.next();
            return new Identifier("::" + cursor.expectIdentifier("function name").text());
        }
        throw cursor.error(token, "Expected expression but found " + token.describe());
    }

    private ExprNode parseIdentifierPrimary(Token token) {
        switch (token.text()) {
            case "true", "false" -> {
                cursor.next();
                return Literal.bool(Boolean.parseBoolean(token.text()));
            }
            case "null" -> {
                cursor.next();
                return new Literal(LiteralKind.NULL, "null");
            }
            case "if" -> {
                return parseIf();
            }
            case "else", "val", "var", "fun" ->
                throw cursor.error(token, "Unexpected keyword '" + token.text() + "' in expression");
            default -> {
                cursor.next();
                return new Identifier(token.text());
            }
        }
    }

    private ExprNode parseIf() {
        cursor.next();
        cursor.expect("(", "'(' after if");
        nesting++;
        ExprNode condition = parseExpression();
        cursor.expect(")", "')' after if condition");
        nesting--;
        List<ExprNode> thenBody = parseBranchBody();
        List<ExprNode> elseBody = List.of();
        if (cursor.peek().is("else")) {
            cursor.next();
            elseBody = parseBranchBody();
        }
        return new Conditional(condition, thenBody, elseBody);
    }

    private List<ExprNode> parseBranchBody() {
        Token token = cursor.peek();
        if (token.is("{")) {
            cursor.next();
            return parseBlock(token);
        }
        return List.of(parseStatement());
    }

    private boolean arrowLambdaAhead() {
        int start = cursor.pos();
        try {
            cursor.skipBalanced("(", ")");
            return cursor.peek().is("=>");
        } finally {
            cursor.reset(start);
        }
    }

    private Lambda parseArrowLambda() {
        Token open = cursor.peek();
        Token close = cursor.skipBalanced("(", ")");
        List<String> parameters = SourceCursor.splitTopLevel(
            cursor.source().substring(open.end(), close.start()));
        cursor.expect("=>", "'=>'");
        Token body = cursor.peek();
        if (body.is("{")) {
            cursor.next();
            return new Lambda(parameters, parseBlock(body), true);
        }
        int saved = nesting;
        nesting = 0;
        ExprNode statement = parseStatement();
        nesting = saved;
        return new Lambda(parameters, List.of(statement), true);
    }

    /**
     * Parses {@code { a, b -> statements }} or {@code { statements }}.
     *
     * @return brace lambda
     */
    Lambda parseBraceLambda() {
        Token open = cursor.expect("{", "'{'");
        List<String> parameters = List.of();
        int afterBrace = cursor.pos();
        Token token = cursor.peek();
        int depth = 0;
        while (!token.isEof() && (token.isIdentifier() || TYPE_TOKENS.contains(token.text()))) {
            if (token.is("(") || token.is("<")) {
                depth++;
            } else if (token.is(")") || token.is(">")) {
                depth--;
            } else if (token.is("->") && depth == 0) {
                parameters = SourceCursor.splitTopLevel(cursor.source().substring(open.end(), token.start()));
                afterBrace = token.end();
                break;
            }
            token = cursor.tokenAfter(token);
        }
        cursor.reset(afterBrace);
        return new Lambda(parameters, parseBlock(open), false);
    }

    /**
     * Turns a string token into a literal or an interpolation of its {@code $name} and
     * {@code ${expr}} templates. Escapes are decoded, so literal text holds the actual characters.
     */
    private ExprNode parseStringLiteral(Token token) {
        String source = cursor.source();
        boolean triple = token.text().startsWith("\"\"\"");
        int quote = triple ? 3 : 1;
        int contentEnd = token.end() - quote;
        List<Segment> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = token.start() + quote;
        while (i < contentEnd) {
            char c = source.charAt(i);
            if (!triple && c == '\\' && i + 1 < contentEnd) {
                i = unescape(source, i, text, token);
                continue;
            }
            if (c == '$' && i + 1 < contentEnd) {
                char next = source.charAt(i + 1);
                if (next == '{') {
                    flush(text, segments);
                    i = parseTemplate(i + 2, segments);
                    continue;
                }
                if (Character.isLetter(next) || next == '_') {
                    flush(text, segments);
                    int end = i + 1;
                    while (end < contentEnd && Lexer.isIdentifierPart(source.charAt(end))) {
                        end++;
                    }
                    segments.add(Segment.expr(new Identifier(source.substring(i + 1, end))));
                    i = end;
                    continue;
                }
            }
            text.append(c);
            i++;
        }
        flush(text, segments);
        if (segments.stream().allMatch(Segment::isText)) {
            return Literal.string(segments.isEmpty() ? "" : segments.get(0).text());
        }
        return new StringInterpolation(segments);
    }

    private int parseTemplate(int start, List<Segment> segments) {
        int resume = cursor.pos();
        int savedNesting = nesting;
        cursor.reset(start);
        nesting = 1;
        ExprNode expr = parseExpression();
        Token close = cursor.expect("}", "'}' to close string template");
        nesting = savedNesting;
        cursor.reset(resume);
        segments.add(Segment.expr(expr));
        return close.end();
    }

    private int unescape(String source, int i, StringBuilder text, Token token) {
        char escaped = source.charAt(i + 1);
        switch (escaped) {
            case 'n' -> text.append('\n');
            case 't' -> text.append('\t');
            case 'r' -> text.append('\r');
            case 'b' -> text.append('\b');
            case '"', '\'', '\\', '$' -> text.append(escaped);
            case 'u' -> {
                if (i + 6 > source.length()) {
                    throw cursor.error(token, "Invalid unicode escape");
                }
                try {
                    text.append((char) Integer.parseInt(source.substring(i + 2, i + 6), 16));
                } catch (NumberFormatException e) {
                    throw cursor.error(token, "Invalid unicode escape '\\u" + source.substring(i + 2, i + 6) + "'");
                }
                return i + 6;
            }
            default -> throw cursor.error(token, "Unknown escape sequence '\\" + escaped + "'");
        }
        return i + 2;
    }

    private static void flush(StringBuilder text, List<Segment> segments) {
        if (text.length() > 0) {
            segments.add(Segment.text(text.toString()));
            text.setLength(0);
        }
    }

    private boolean continues(Token token) {
        return !token.newlineBefore() || nesting > 0 || CONTINUATIONS.contains(token.text());
    }

    SourcePosition position() {
        return cursor.position();
    }
}
