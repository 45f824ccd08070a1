package com.whitehall.core.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Expression tree node.
 *
 * <p>Source-level forms ({@link Ternary}, arrow {@link Lambda}, {@link ArrayLiteral}) are produced by
 * the parser; target-level forms ({@link Conditional}, {@link Dispatch}) are produced by the
 * transformer. All nodes are immutable; passes build new trees instead of editing old ones.
 */
public interface ExprNode {

    /** Variable or function name. */
    record Identifier(String name) implements ExprNode {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * Scalar literal. For {@link LiteralKind#STRING} the text is the unescaped string content;
     * for every other kind it is the source spelling.
     */
    record Literal(LiteralKind kind, String text) implements ExprNode {
        public Literal {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }

        public static Literal string(String text) {
            return new Literal(LiteralKind.STRING, text);
        }

        public static Literal number(String text) {
            return new Literal(LiteralKind.NUMBER, text);
        }

        public static Literal bool(boolean value) {
            return new Literal(LiteralKind.BOOLEAN, String.valueOf(value));
        }
    }

    /** Literal categories. */
    enum LiteralKind { NUMBER, STRING, CHAR, BOOLEAN, NULL }

    /** Text with embedded expressions, from markup text or a string template. */
    record StringInterpolation(List<Segment> segments) implements ExprNode {
        public StringInterpolation {
            segments = segments != null ? List.copyOf(segments) : List.of();
        }

        /**
         * Whether the interpolation embeds at least one expression.
         *
         * @return true if any segment is an expression
         */
        public boolean hasExpressions() {
            return segments.stream().anyMatch(s -> !s.isText());
        }
    }

    /** Either literal text or an embedded expression. */
    record Segment(String text, ExprNode expression) {
        public Segment {
            if ((text == null) == (expression == null)) {
                throw new IllegalArgumentException("segment must hold exactly one of text or expression");
            }
        }

        public static Segment text(String text) {
            return new Segment(text, null);
        }

        public static Segment expr(ExprNode expression) {
            return new Segment(null, expression);
        }

        public boolean isText() {
            return text != null;
        }
    }

    /** {@code left op right}; also type operators such as {@code as} and {@code is}. */
    record BinaryOp(ExprNode left, String operator, ExprNode right) implements ExprNode {
        public BinaryOp {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /** Prefix ({@code !x}, {@code -x}, {@code ++x}) or postfix ({@code x++}, {@code x!!}) operator. */
    record UnaryOp(String operator, ExprNode operand, boolean postfix) implements ExprNode {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /** Source ternary {@code cond ? then : else}. */
    record Ternary(ExprNode condition, ExprNode thenExpr, ExprNode elseExpr) implements ExprNode {
        public Ternary {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenExpr, "thenExpr must not be null");
            Objects.requireNonNull(elseExpr, "elseExpr must not be null");
        }
    }

    /** Target conditional expression {@code if (cond) then else else}. */
    record Conditional(ExprNode condition, List<ExprNode> thenBody, List<ExprNode> elseBody) implements ExprNode {
        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            thenBody = thenBody != null ? List.copyOf(thenBody) : List.of();
            elseBody = elseBody != null ? List.copyOf(elseBody) : List.of();
        }
    }

    /** Function call with optional type arguments and trailing lambda. */
    record Call(ExprNode callee, String typeArguments, List<Argument> arguments, Lambda trailingLambda)
        implements ExprNode {
        public Call {
            Objects.requireNonNull(callee, "callee must not be null");
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
        }

        public static Call of(String function, ExprNode... args) {
            return new Call(new Identifier(function), null,
                Arrays.stream(args).map(Argument::positional).toList(), null);
        }
    }

    /** Call argument, optionally named. */
    record Argument(String name, ExprNode value) {
        public Argument {
            Objects.requireNonNull(value, "value must not be null");
        }

        public static Argument positional(ExprNode value) {
            return new Argument(null, value);
        }
    }

    /** {@code target.member} or {@code target?.member}. */
    record MemberAccess(ExprNode target, String member, boolean safe) implements ExprNode {
        public MemberAccess {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(member, "member must not be null");
        }
    }

    /** {@code target[index]}. */
    record IndexAccess(ExprNode target, ExprNode index) implements ExprNode {
        public IndexAccess {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(index, "index must not be null");
        }
    }

    /** {@code [a, b, c]}. */
    record ArrayLiteral(List<ExprNode> elements) implements ExprNode {
        public ArrayLiteral {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }
    }

    /**
     * Lambda. {@code arrow} is true for the source form {@code (a, b) => body}; the transformer
     * produces brace lambdas only.
     */
    record Lambda(List<String> parameters, List<ExprNode> body, boolean arrow) implements ExprNode {
        public Lambda {
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /** {@code (inner)} as written by the author. */
    record Parenthesized(ExprNode inner) implements ExprNode {
        public Parenthesized {
            Objects.requireNonNull(inner, "inner must not be null");
        }
    }

    /** Assignment statement inside a lambda block: {@code target op value}. */
    record Assignment(ExprNode target, String operator, ExprNode value, SourcePosition position)
        implements ExprNode {
        public Assignment {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
            position = position != null ? position : SourcePosition.UNKNOWN;
        }
    }

    /** {@code val name[: Type] = initializer} inside a lambda block. */
    record LocalVariable(boolean mutable, String name, String type, ExprNode initializer) implements ExprNode {
        public LocalVariable {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(initializer, "initializer must not be null");
        }
    }

    /** {@code scope.launch(dispatcher) { body }}, lowered from {@code io { }}, {@code cpu { }}, {@code main { }}. */
    record Dispatch(Dispatcher dispatcher, String scope, List<ExprNode> body) implements ExprNode {
        public Dispatch {
            Objects.requireNonNull(dispatcher, "dispatcher must not be null");
            Objects.requireNonNull(scope, "scope must not be null");
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /** Dispatch block keyword and the target dispatcher it selects. */
    enum Dispatcher {
        IO("io", "Dispatchers.IO"),
        CPU("cpu", "Dispatchers.Default"),
        MAIN("main", "Dispatchers.Main");

        private final String keyword;
        private final String target;

        Dispatcher(String keyword, String target) {
            this.keyword = keyword;
            this.target = target;
        }

        public String keyword() {
            return keyword;
        }

        public String target() {
            return target;
        }

        public static Dispatcher fromKeyword(String keyword) {
            for (Dispatcher d : values()) {
                if (d.keyword.equals(keyword)) {
                    return d;
                }
            }
            return null;
        }
    }
}
