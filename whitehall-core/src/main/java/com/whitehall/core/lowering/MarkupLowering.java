package com.whitehall.core.lowering;

import com.whitehall.core.ast.ControlDirective;
import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.Lambda;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.ExprNode.Segment;
import com.whitehall.core.ast.ExprNode.StringInterpolation;
import com.whitehall.core.ast.MarkupChild;
import com.whitehall.core.ast.MarkupNode;
import com.whitehall.core.ast.TextSegment;
import com.whitehall.core.diagnostic.Diagnostic;
import com.whitehall.core.diagnostic.DiagnosticKind;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.ir.UiNode;
import com.whitehall.core.ir.UiNode.ComponentCall;
import com.whitehall.core.ir.UiNode.Content;
import com.whitehall.core.registry.ComponentRegistry;
import com.whitehall.core.registry.ComponentSpec;
import com.whitehall.core.transform.ExpressionTransformer;
import com.whitehall.core.transform.LoweredProps;
import com.whitehall.core.transform.PropTransformer;
import com.whitehall.core.transform.TransformContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lowers markup trees to composable statements.
 *
 * <p>Each child is lowered with the kind of its enclosing container, which decides how
 * {@code @for} repeats and whether plain children need an {@code item} wrapper. Unknown components
 * are collected as diagnostics so that one pass reports all of them.
 */
final class MarkupLowering {

    private static final String PADDING_PARAMETER = "paddingValues";
    private static final List<String> DIRECTIVE_LOOKALIKES = List.of("if (", "for (", "when ");

    private final ComponentRegistry registry;
    private final PropTransformer props;
    private final ExpressionTransformer expressions;
    private final Diagnostics diagnostics;
    private final boolean strict;
    private final Set<String> userComponents;

    MarkupLowering(ComponentRegistry registry, PropTransformer props, ExpressionTransformer expressions,
                   Diagnostics diagnostics, boolean strict, Set<String> userComponents) {
        this.registry = registry;
        this.props = props;
        this.expressions = expressions;
        this.diagnostics = diagnostics;
        this.strict = strict;
        this.userComponents = Set.copyOf(userComponents);
    }

    List<UiNode> lowerAll(List<? extends MarkupChild> children, ContainerKind container, TransformContext ctx) {
        List<UiNode> lowered = new ArrayList<>();
        for (MarkupChild child : children) {
            List<UiNode> nodes = lowerChild(child, container, ctx);
            if (container == ContainerKind.LAZY && !(child instanceof ControlDirective)) {
                if (!nodes.isEmpty()) {
                    lowered.add(new UiNode.LazyItem(nodes));
                }
            } else {
                lowered.addAll(nodes);
            }
        }
        return lowered;
    }

    private List<UiNode> lowerChild(MarkupChild child, ContainerKind container, TransformContext ctx) {
        if (child instanceof MarkupNode node) {
            return lowerNode(node, ctx);
        }
        if (child instanceof TextSegment text) {
            return List.of(textCall(text, ctx));
        }
        if (child instanceof ControlDirective.If directive) {
            return List.of(lowerIf(directive, container, ctx));
        }
        if (child instanceof ControlDirective.For directive) {
            return lowerFor(directive, container, ctx);
        }
        if (child instanceof ControlDirective.When directive) {
            return List.of(lowerWhen(directive, container, ctx));
        }
        throw new IllegalArgumentException("Unknown markup child " + child.getClass().getSimpleName());
    }

    List<UiNode> lowerNode(MarkupNode node, TransformContext ctx) {
        ComponentSpec spec = registry.find(node.tag()).orElse(null);
        if (spec == null) {
            if (!userComponents.contains(node.tag())) {
                String message = "Unknown component <" + node.tag() + ">; it is not a built-in component, "
                    + "declared in this file, or imported";
                if (strict) {
                    diagnostics.report(Diagnostic.error(DiagnosticKind.UNRESOLVED_COMPONENT, ctx.fileName(),
                        node.position(), message).withComponent(node.tag(), null));
                    return List.of();
                }
                diagnostics.report(Diagnostic.warning(DiagnosticKind.UNRESOLVED_COMPONENT, ctx.fileName(),
                    node.position(), message).withComponent(node.tag(), null));
            }
            LoweredProps lowered = props.lowerUserComponent(node, ctx, slot -> lowerNode(slot, ctx));
            List<UiNode> children = lowerAll(node.children(), ContainerKind.LAYOUT, ctx);
            return List.of(new ComponentCall(node.tag(), lowered.arguments(),
                children.isEmpty() ? null : Content.of(children)));
        }

        LoweredProps lowered = props.lower(node, spec, ctx, slot -> lowerNode(slot, ctx));
        List<Argument> arguments = new ArrayList<>(lowered.arguments());
        List<UiNode> children = new ArrayList<>(lowered.leadingChildren());
        Content content = null;
        switch (spec.children()) {
            case TEXT -> {
                if (!node.children().isEmpty()) {
                    arguments.add(0, new Argument("text", childText(node, ctx)));
                }
            }
            case NONE -> {
                if (!node.children().isEmpty()) {
                    reportUnsupported(node, ctx, "<" + node.tag() + "> does not take children");
                }
            }
            case CONTENT -> {
                children.addAll(lowerAll(node.children(), ContainerKind.LAYOUT, ctx));
                content = Content.of(children);
            }
            case LAZY -> {
                children.addAll(lowerAll(node.children(), ContainerKind.LAZY, ctx));
                content = Content.of(children);
            }
            case PADDED_CONTENT -> {
                children.addAll(lowerAll(node.children(), ContainerKind.LAYOUT, ctx));
                ExprNode padding = new Call(new MemberAccess(new Identifier("Modifier"), "padding", false), null,
                    List.of(Argument.positional(new Identifier(PADDING_PARAMETER))), null);
                UiNode box = new ComponentCall("Box", List.of(new Argument("modifier", padding)), Content.of(children));
                content = new Content(List.of(PADDING_PARAMETER), List.of(box));
            }
        }
        return List.of(new ComponentCall(node.tag(), arguments, content));
    }

    private ExprNode childText(MarkupNode node, TransformContext ctx) {
        List<Segment> segments = new ArrayList<>();
        for (MarkupChild child : node.children()) {
            if (child instanceof TextSegment text) {
                if (!segments.isEmpty()) {
                    segments.add(Segment.text(" "));
                }
                segments.addAll(text.content().segments());
            } else {
                reportUnsupported(node, ctx, "<" + node.tag() + "> accepts only text content");
            }
        }
        return textValue(new StringInterpolation(segments), ctx);
    }

    private UiNode textCall(TextSegment text, TransformContext ctx) {
        List<Segment> segments = text.content().segments();
        if (!segments.isEmpty() && segments.get(0).isText()) {
            String leading = segments.get(0).text().strip();
            DIRECTIVE_LOOKALIKES.stream().filter(leading::startsWith).findFirst().ifPresent(prefix ->
                diagnostics.report(Diagnostic.warning(DiagnosticKind.STYLE_HINT, ctx.fileName(), text.position(),
                    "Text starts with '" + prefix.strip() + "'; did you mean the @" + prefix.replace("(", "").strip()
                        + " directive?")));
        }
        return new ComponentCall("Text", List.of(new Argument("text", textValue(text.content(), ctx))), null);
    }

    private ExprNode textValue(StringInterpolation content, TransformContext ctx) {
        if (!content.hasExpressions()) {
            StringBuilder sb = new StringBuilder();
            content.segments().forEach(s -> sb.append(s.text()));
            return Literal.string(sb.toString());
        }
        return expressions.transform(content, ctx);
    }

    private UiNode lowerIf(ControlDirective.If directive, ContainerKind container, TransformContext ctx) {
        List<UiNode.IfBranch> branches = new ArrayList<>();
        for (ControlDirective.Branch branch : directive.branches()) {
            ExprNode condition = branch.condition() != null ? expressions.transform(branch.condition(), ctx) : null;
            branches.add(new UiNode.IfBranch(condition, lowerAll(branch.children(), container, ctx)));
        }
        return new UiNode.IfChain(branches);
    }

    private UiNode lowerWhen(ControlDirective.When directive, ContainerKind container, TransformContext ctx) {
        ExprNode subject = directive.subject() != null ? expressions.transform(directive.subject(), ctx) : null;
        List<UiNode.WhenBranch> branches = new ArrayList<>();
        for (ControlDirective.Branch branch : directive.branches()) {
            List<ExprNode> conditions = new ArrayList<>();
            if (branch.condition() != null) {
                conditions.add(expressions.transform(branch.condition(), ctx));
                branch.conditions().forEach(c -> conditions.add(expressions.transform(c, ctx)));
            }
            branches.add(new UiNode.WhenBranch(conditions, lowerAll(branch.children(), container, ctx)));
        }
        return new UiNode.WhenBlock(subject, branches);
    }

    private List<UiNode> lowerFor(ControlDirective.For directive, ContainerKind container, TransformContext ctx) {
        ExprNode iterable = expressions.transform(directive.iterable(), ctx);
        List<UiNode> prelude = new ArrayList<>();
        if (!directive.emptyBody().isEmpty() && !isStable(iterable)) {
            // Evaluate once for both the emptiness test and the loop
            String name = directive.loopVar() + "Items";
            prelude.add(new UiNode.LocalValue(false, name, null, false, iterable));
            iterable = new Identifier(name);
        }

        UiNode loop = switch (LoopStrategy.forContainer(container)) {
            case LAZY_ITEMS -> new UiNode.LazyItems(iterable, directive.indexVar(), directive.loopVar(),
                keySelector(directive, ctx),
                lowerAll(directive.body(), ContainerKind.LAYOUT, ctx));
            case INLINE_REPETITION -> new UiNode.InlineRepeat(iterable, directive.indexVar(), directive.loopVar(),
                inlineKey(directive, ctx),
                lowerAll(directive.body(), ContainerKind.LAYOUT, ctx));
        };

        if (directive.emptyBody().isEmpty()) {
            prelude.add(loop);
            return prelude;
        }
        ExprNode isEmpty = new Call(new MemberAccess(iterable, "isEmpty", false), null, List.of(), null);
        prelude.add(new UiNode.IfChain(List.of(
            new UiNode.IfBranch(isEmpty, lowerAll(directive.emptyBody(), container, ctx)),
            new UiNode.IfBranch(null, List.of(loop)))));
        return prelude;
    }

    private ExprNode keySelector(ControlDirective.For directive, TransformContext ctx) {
        if (directive.keySelector() == null) {
            return null;
        }
        ExprNode selector = directive.keySelector();
        if (!(selector instanceof Lambda)) {
            selector = new Lambda(List.of(directive.loopVar()), List.of(selector), false);
        }
        return expressions.transform(selector, ctx);
    }

    /**
     * The key for inline repetition is the selector applied to the loop variable.
     */
    private ExprNode inlineKey(ControlDirective.For directive, TransformContext ctx) {
        ExprNode selector = directive.keySelector();
        if (selector == null) {
            return null;
        }
        if (selector instanceof Lambda lambda && lambda.body().size() == 1 && lambda.parameters().size() <= 1) {
            String parameter = lambda.parameters().isEmpty() ? "it" : lambda.parameters().get(0);
            selector = IdentifierRenamer.rename(lambda.body().get(0), parameter, directive.loopVar());
        } else if (selector instanceof Lambda) {
            reportUnsupported(directive, ctx, "A key selector takes one parameter and a single expression");
            return null;
        }
        return expressions.transform(selector, ctx);
    }

    private static boolean isStable(ExprNode iterable) {
        ExprNode current = iterable;
        while (current instanceof MemberAccess access) {
            current = access.target();
        }
        return current instanceof Identifier;
    }

    private void reportUnsupported(MarkupNode node, TransformContext ctx, String message) {
        diagnostics.report(Diagnostic.error(DiagnosticKind.UNSUPPORTED_PROP, ctx.fileName(), node.position(), message)
            .withComponent(node.tag(), null));
    }

    private void reportUnsupported(ControlDirective.For directive, TransformContext ctx, String message) {
        diagnostics.report(Diagnostic.error(DiagnosticKind.UNSUPPORTED_PROP, ctx.fileName(), directive.position(), message));
    }
}
