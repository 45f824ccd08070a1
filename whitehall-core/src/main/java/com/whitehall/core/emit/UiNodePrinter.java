package com.whitehall.core.emit;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Conditional;
import com.whitehall.core.ast.ExprNode.Ternary;
import com.whitehall.core.ast.ExprNode.UnaryOp;
import com.whitehall.core.ir.UiNode;
import com.whitehall.core.ir.UiNode.ComponentCall;
import com.whitehall.core.ir.UiNode.Content;
import com.whitehall.core.ir.UiNode.IfBranch;
import com.whitehall.core.ir.UiNode.IfChain;
import com.whitehall.core.ir.UiNode.InlineRepeat;
import com.whitehall.core.ir.UiNode.LazyItem;
import com.whitehall.core.ir.UiNode.LazyItems;
import com.whitehall.core.ir.UiNode.LocalFunction;
import com.whitehall.core.ir.UiNode.LocalValue;
import com.whitehall.core.ir.UiNode.RawCode;
import com.whitehall.core.ir.UiNode.WhenBlock;
import com.whitehall.core.ir.UiNode.WhenBranch;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints lowered composable statements; nested blocks are indented relative to the first line.
 */
final class UiNodePrinter {

    private final ExpressionPrinter expressions;

    UiNodePrinter(ExpressionPrinter expressions) {
        this.expressions = expressions;
    }

    String print(UiNode node) {
        if (node instanceof ComponentCall call) {
            return printCall(call);
        }
        if (node instanceof IfChain chain) {
            return printIf(chain);
        }
        if (node instanceof WhenBlock when) {
            return printWhen(when);
        }
        if (node instanceof InlineRepeat repeat) {
            return printInline(repeat);
        }
        if (node instanceof LazyItems items) {
            return printLazyItems(items);
        }
        if (node instanceof LazyItem item) {
            return "item " + block(item.body());
        }
        if (node instanceof LocalValue value) {
            return (value.mutable() ? "var " : "val ") + value.name()
                + (value.type() != null ? ": " + value.type() : "")
                + (value.delegated() ? " by " : " = ")
                + expressions.print(value.value());
        }
        if (node instanceof LocalFunction function) {
            return function.signature() + " " + codeBlock(function.body());
        }
        if (node instanceof RawCode raw) {
            return CodeWriter.dedent(raw.text());
        }
        throw new IllegalArgumentException("Cannot print node " + node.getClass().getSimpleName());
    }

    String printAll(List<UiNode> nodes) {
        return String.join("\n", nodes.stream().map(this::print).toList());
    }

    private String printCall(ComponentCall call) {
        StringBuilder sb = new StringBuilder(call.name());
        Content content = call.content();
        if (!call.arguments().isEmpty() || content == null) {
            sb.append(expressions.printArguments(call.arguments()));
        }
        if (content != null) {
            if (content.parameters().isEmpty()) {
                sb.append(" ").append(block(content.children()));
            } else {
                sb.append(" ").append(expressions.printLambda(content.parameters(),
                    content.children().stream().map(this::print).toList()));
            }
        }
        return sb.toString();
    }

    private String printIf(IfChain chain) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chain.branches().size(); i++) {
            IfBranch branch = chain.branches().get(i);
            if (i > 0) {
                sb.append(" else ");
            }
            if (branch.condition() != null) {
                sb.append("if (").append(expressions.print(branch.condition())).append(") ");
            }
            sb.append(block(branch.body()));
        }
        return sb.toString();
    }

    private String printWhen(WhenBlock when) {
        StringBuilder sb = new StringBuilder("when ");
        if (when.subject() != null) {
            sb.append("(").append(expressions.print(when.subject())).append(") ");
        }
        List<String> branches = new ArrayList<>();
        for (WhenBranch branch : when.branches()) {
            String head = branch.isElse()
                ? "else"
                : String.join(", ", branch.conditions().stream().map(expressions::print).toList());
            String body = branch.body().size() == 1 ? print(branch.body().get(0)) : null;
            if (body != null && !body.contains("\n")) {
                branches.add(head + " -> " + body);
            } else {
                branches.add(head + " -> " + block(branch.body()));
            }
        }
        // Statement when over enums and sealed types must be exhaustive
        if (when.branches().stream().noneMatch(WhenBranch::isElse)) {
            branches.add("else -> {}");
        }
        return sb.append(lines(branches)).toString();
    }

    private String printInline(InlineRepeat repeat) {
        String receiver = receiver(repeat.iterable());
        List<String> parameters = repeat.indexVar() != null
            ? List.of(repeat.indexVar(), repeat.loopVar())
            : List.of(repeat.loopVar());
        String function = repeat.indexVar() != null ? "forEachIndexed" : "forEach";
        List<String> body = repeat.body().stream().map(this::print).toList();
        if (repeat.key() != null) {
            body = List.of("key(" + expressions.print(repeat.key()) + ") " + lines(body));
        }
        return receiver + "." + function + " " + lambdaBlock(parameters, body);
    }

    private String printLazyItems(LazyItems items) {
        List<ExprNode.Argument> arguments = new ArrayList<>();
        arguments.add(ExprNode.Argument.positional(items.iterable()));
        if (items.keySelector() != null) {
            arguments.add(new ExprNode.Argument("key", items.keySelector()));
        }
        String function = items.indexVar() != null ? "itemsIndexed" : "items";
        List<String> parameters = items.indexVar() != null
            ? List.of(items.indexVar(), items.loopVar())
            : List.of(items.loopVar());
        return function + expressions.printArguments(arguments) + " "
            + lambdaBlock(parameters, items.body().stream().map(this::print).toList());
    }

    private String receiver(ExprNode iterable) {
        String text = expressions.print(iterable);
        boolean needsParentheses = iterable instanceof BinaryOp || iterable instanceof Conditional
            || iterable instanceof Ternary || (iterable instanceof UnaryOp unary && !unary.postfix());
        return needsParentheses ? "(" + text + ")" : text;
    }

    private String block(List<UiNode> body) {
        return lines(body.stream().map(this::print).toList());
    }

    private static String lambdaBlock(List<String> parameters, List<String> statements) {
        StringBuilder sb = new StringBuilder("{ ").append(String.join(", ", parameters)).append(" ->\n");
        for (String statement : statements) {
            sb.append(ExpressionPrinter.indent(statement)).append("\n");
        }
        return sb.append("}").toString();
    }

    private static String lines(List<String> statements) {
        if (statements.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{\n");
        for (String statement : statements) {
            sb.append(ExpressionPrinter.indent(statement)).append("\n");
        }
        return sb.append("}").toString();
    }

    private static String codeBlock(String body) {
        String text = CodeWriter.dedent(body);
        return text.isEmpty() ? "{}" : lines(List.of(text));
    }
}
