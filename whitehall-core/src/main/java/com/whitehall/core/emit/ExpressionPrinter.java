package com.whitehall.core.emit;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.ArrayLiteral;
import com.whitehall.core.ast.ExprNode.Assignment;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Conditional;
import com.whitehall.core.ast.ExprNode.Dispatch;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.IndexAccess;
import com.whitehall.core.ast.ExprNode.Lambda;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.LocalVariable;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.ExprNode.Parenthesized;
import com.whitehall.core.ast.ExprNode.StringInterpolation;
import com.whitehall.core.ast.ExprNode.Ternary;
import com.whitehall.core.ast.ExprNode.UnaryOp;
import com.whitehall.core.ir.ContentLambda;
import com.whitehall.core.ir.UiNode;

import java.util.List;
import java.util.Map;

/**
 * Prints expression trees as Kotlin source.
 *
 * <p>Output may span several lines. Continuation lines are indented relative to column zero of
 * the first line; {@link CodeWriter} shifts them to the indentation of the surrounding code.
 * Binary operands are parenthesized by precedence, so trees built by the transformer print
 * correctly without explicit {@link Parenthesized} nodes.
 */
public final class ExpressionPrinter {

    static final String INDENT = "    ";

    /** Calls whose inline argument list exceeds this length are printed one argument per line. */
    static final int MAX_INLINE_LENGTH = 100;

    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
        Map.entry("||", 1),
        Map.entry("&&", 2),
        Map.entry("==", 3), Map.entry("!=", 3), Map.entry("===", 3), Map.entry("!==", 3),
        Map.entry("<", 4), Map.entry(">", 4), Map.entry("<=", 4), Map.entry(">=", 4),
        Map.entry("in", 4), Map.entry("!in", 4), Map.entry("is", 4), Map.entry("!is", 4),
        Map.entry("?:", 5),
        Map.entry("until", 6), Map.entry("downTo", 6), Map.entry("step", 6),
        Map.entry("..", 7), Map.entry("..<", 7),
        Map.entry("+", 8), Map.entry("-", 8),
        Map.entry("*", 9), Map.entry("/", 9), Map.entry("%", 9),
        Map.entry("as", 10), Map.entry("as?", 10)
    );

    private static final int PREFIX_PRECEDENCE = 11;
    private static final int POSTFIX_PRECEDENCE = 12;

    private final UiNodePrinter nodePrinter;

    public ExpressionPrinter() {
        this.nodePrinter = new UiNodePrinter(this);
    }

    UiNodePrinter nodePrinter() {
        return nodePrinter;
    }

    /**
     * Prints lowered statements, one per line.
     *
     * @param nodes statements
     * @return Kotlin source
     */
    public String printNodes(List<UiNode> nodes) {
        return nodePrinter.printAll(nodes);
    }

    /**
     * Prints an expression or statement.
     *
     * @param expr expression tree
     * @return Kotlin source
     */
    public String print(ExprNode expr) {
        if (expr instanceof Identifier id) {
            return id.name();
        }
        if (expr instanceof Literal literal) {
            return literal.kind() == ExprNode.LiteralKind.STRING
                ? "\"" + escape(literal.text()) + "\""
                : literal.text();
        }
        if (expr instanceof StringInterpolation interpolation) {
            return printInterpolation(interpolation);
        }
        if (expr instanceof BinaryOp binary) {
            return printBinary(binary);
        }
        if (expr instanceof UnaryOp unary) {
            String operand = printOperand(unary.operand(), unary.postfix() ? POSTFIX_PRECEDENCE : PREFIX_PRECEDENCE);
            return unary.postfix() ? operand + unary.operator() : unary.operator() + operand;
        }
        if (expr instanceof Ternary ternary) {
            return print(new Conditional(ternary.condition(), List.of(ternary.thenExpr()), List.of(ternary.elseExpr())));
        }
        if (expr instanceof Conditional conditional) {
            return printConditional(conditional);
        }
        if (expr instanceof Call call) {
            return printCall(call);
        }
        if (expr instanceof MemberAccess access) {
            return printOperand(access.target(), POSTFIX_PRECEDENCE) + (access.safe() ? "?." : ".") + access.member();
        }
        if (expr instanceof IndexAccess index) {
            return printOperand(index.target(), POSTFIX_PRECEDENCE) + "[" + print(index.index()) + "]";
        }
        if (expr instanceof ArrayLiteral array) {
            return printCall(new Call(new Identifier("listOf"), null,
                array.elements().stream().map(Argument::positional).toList(), null));
        }
        if (expr instanceof Lambda lambda) {
            return printLambda(lambda.parameters(), lambda.body().stream().map(this::print).toList());
        }
        if (expr instanceof Parenthesized parenthesized) {
            return "(" + print(parenthesized.inner()) + ")";
        }
        if (expr instanceof Assignment assignment) {
            return print(assignment.target()) + " " + assignment.operator() + " " + print(assignment.value());
        }
        if (expr instanceof LocalVariable local) {
            return (local.mutable() ? "var " : "val ") + local.name()
                + (local.type() != null ? ": " + local.type() : "")
                + " = " + print(local.initializer());
        }
        if (expr instanceof Dispatch dispatch) {
            return dispatch.scope() + ".launch(" + dispatch.dispatcher().target() + ") "
                + printLambda(List.of(), dispatch.body().stream().map(this::print).toList());
        }
        if (expr instanceof ContentLambda content) {
            return printLambda(content.parameters(), content.body().stream().map(nodePrinter::print).toList());
        }
        throw new IllegalArgumentException("Cannot print expression node " + expr.getClass().getSimpleName());
    }

    /**
     * Prints a call argument list, inline when short, otherwise one argument per line.
     *
     * @param arguments arguments
     * @return text including the parentheses
     */
    public String printArguments(List<Argument> arguments) {
        List<String> printed = arguments.stream()
            .map(a -> a.name() != null ? a.name() + " = " + print(a.value()) : print(a.value()))
            .toList();
        String inline = String.join(", ", printed);
        if (inline.length() <= MAX_INLINE_LENGTH && !inline.contains("\n")) {
            return "(" + inline + ")";
        }
        StringBuilder sb = new StringBuilder("(\n");
        for (int i = 0; i < printed.size(); i++) {
            sb.append(indent(printed.get(i)));
            sb.append(i < printed.size() - 1 ? ",\n" : "\n");
        }
        return sb.append(")").toString();
    }

    /**
     * Escapes text for a Kotlin string literal; {@code $} is escaped so text never starts a template.
     *
     * @param text raw text
     * @return escaped text without quotes
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '$' -> sb.append("\\$");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    String printLambda(List<String> parameters, List<String> statements) {
        String head = parameters.isEmpty() ? "{" : "{ " + String.join(", ", parameters) + " ->";
        if (statements.isEmpty()) {
            return parameters.isEmpty() ? "{}" : head + " }";
        }
        if (statements.size() == 1 && !statements.get(0).contains("\n")
            && head.length() + statements.get(0).length() < MAX_INLINE_LENGTH) {
            return head + " " + statements.get(0) + " }";
        }
        StringBuilder sb = new StringBuilder(head).append("\n");
        for (String statement : statements) {
            sb.append(indent(statement)).append("\n");
        }
        return sb.append("}").toString();
    }

    /** Indents every non-blank line by one level. */
    public static String indent(String text) {
        StringBuilder sb = new StringBuilder();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append("\n");
            }
            if (!lines[i].isBlank()) {
                sb.append(INDENT).append(lines[i]);
            }
        }
        return sb.toString();
    }

    private String printInterpolation(StringInterpolation interpolation) {
        StringBuilder sb = new StringBuilder("\"");
        for (ExprNode.Segment segment : interpolation.segments()) {
            if (segment.isText()) {
                sb.append(escape(segment.text()));
            } else {
                sb.append("${").append(print(segment.expression())).append("}");
            }
        }
        return sb.append("\"").toString();
    }

    private String printBinary(BinaryOp binary) {
        int precedence = PRECEDENCE.getOrDefault(binary.operator(), 6);
        String left = printOperand(binary.left(), precedence);
        // Binary operators are left associative; an equal-precedence right operand needs parentheses
        String right = printOperand(binary.right(), precedence + 1);
        if (binary.operator().equals("..") || binary.operator().equals("..<")) {
            return left + binary.operator() + right;
        }
        return left + " " + binary.operator() + " " + right;
    }

    private String printOperand(ExprNode operand, int minimumPrecedence) {
        String text = print(operand);
        int precedence;
        if (operand instanceof BinaryOp binary) {
            precedence = PRECEDENCE.getOrDefault(binary.operator(), 6);
        } else if (operand instanceof UnaryOp unary) {
            precedence = unary.postfix() ? POSTFIX_PRECEDENCE : PREFIX_PRECEDENCE;
        } else if (operand instanceof Conditional || operand instanceof Ternary
            || operand instanceof Assignment || operand instanceof Lambda) {
            precedence = 0;
        } else {
            precedence = Integer.MAX_VALUE;
        }
        return precedence < minimumPrecedence ? "(" + text + ")" : text;
    }

    private String printConditional(Conditional conditional) {
        String condition = print(conditional.condition());
        List<String> thenBody = conditional.thenBody().stream().map(this::print).toList();
        List<String> elseBody = conditional.elseBody().stream().map(this::print).toList();
        boolean simple = thenBody.size() == 1 && elseBody.size() <= 1
            && thenBody.stream().noneMatch(s -> s.contains("\n"))
            && elseBody.stream().noneMatch(s -> s.contains("\n"));
        if (simple) {
            String text = "if (" + condition + ") " + thenBody.get(0);
            return elseBody.isEmpty() ? text : text + " else " + elseBody.get(0);
        }
        StringBuilder sb = new StringBuilder("if (").append(condition).append(") ").append(block(thenBody));
        if (conditional.elseBody().size() == 1 && conditional.elseBody().get(0) instanceof Conditional) {
            sb.append(" else ").append(elseBody.get(0));
        } else if (!elseBody.isEmpty()) {
            sb.append(" else ").append(block(elseBody));
        }
        return sb.toString();
    }

    private String printCall(Call call) {
        StringBuilder sb = new StringBuilder(printOperand(call.callee(), POSTFIX_PRECEDENCE));
        if (call.typeArguments() != null) {
            sb.append(call.typeArguments());
        }
        if (!call.arguments().isEmpty() || call.trailingLambda() == null) {
            sb.append(printArguments(call.arguments()));
        }
        if (call.trailingLambda() != null) {
            sb.append(" ").append(print(call.trailingLambda()));
        }
        return sb.toString();
    }

    private static String block(List<String> statements) {
        StringBuilder sb = new StringBuilder("{\n");
        for (String statement : statements) {
            sb.append(indent(statement)).append("\n");
        }
        return sb.append("}").toString();
    }
}
