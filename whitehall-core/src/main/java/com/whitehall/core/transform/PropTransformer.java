package com.whitehall.core.transform;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.Assignment;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Conditional;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.Lambda;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.MarkupNode;
import com.whitehall.core.ast.PropValue;
import com.whitehall.core.ast.StateVar;
import com.whitehall.core.diagnostic.Diagnostic;
import com.whitehall.core.diagnostic.DiagnosticKind;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.diagnostic.UnsupportedPropError;
import com.whitehall.core.ir.ContentLambda;
import com.whitehall.core.ir.UiNode;
import com.whitehall.core.registry.ComponentSpec;
import com.whitehall.core.registry.PropKind;
import com.whitehall.core.registry.PropSpec;
import com.whitehall.core.registry.ValueFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Lowers markup props to call arguments using the component registry.
 *
 * <p>Every decision is driven by the prop's {@link PropSpec}; there are no per-component branches.
 * Problems with a single prop are collected as {@link UnsupportedPropError} diagnostics so one pass
 * reports all of them. In permissive mode an undeclared prop is passed through with a warning.
 */
public final class PropTransformer {

    private static final Logger log = LoggerFactory.getLogger(PropTransformer.class);

    private final ExpressionTransformer expressions;
    private final Diagnostics diagnostics;
    private final boolean strict;

    public PropTransformer(ExpressionTransformer expressions, Diagnostics diagnostics, boolean strict) {
        this.expressions = expressions;
        this.diagnostics = diagnostics;
        this.strict = strict;
    }

    /**
     * Lowers the props of a registered component.
     *
     * @param node markup node
     * @param spec component spec
     * @param ctx transform context
     * @param slots lowering for markup values
     * @return arguments and leading children
     */
    public LoweredProps lower(MarkupNode node, ComponentSpec spec, TransformContext ctx, SlotLowering slots) {
        List<Argument> arguments = new ArrayList<>();
        List<UiNode> leading = new ArrayList<>();
        ExprNode modifier = null;
        boolean hasModifier = false;

        for (Map.Entry<String, PropValue> entry : node.props().entrySet()) {
            String name = entry.getKey();
            PropValue value = entry.getValue();
            PropSpec prop = spec.prop(name).orElse(null);
            try {
                if (prop == null) {
                    arguments.add(undeclared(node, name, value, ctx, slots));
                    continue;
                }
                switch (prop.kind()) {
                    case PLAIN -> arguments.add(new Argument(prop.target(), plain(node, prop, value, ctx)));
                    case COMPOSABLE_SLOT -> arguments.add(new Argument(prop.target(), slot(node, prop, value, ctx, slots)));
                    case CALLBACK -> arguments.add(new Argument(prop.target(), callback(node, prop, value, ctx)));
                    case BINDING -> arguments.addAll(binding(node, prop, value, ctx));
                    case CHILD_TEXT -> leading.add(text(textValue(node, prop, value, ctx)));
                    case MODIFIER_CHAIN -> {
                        if (!hasModifier) {
                            modifier = modifierBase(node, ctx);
                            hasModifier = true;
                        }
                        if (!prop.name().equals("modifier")) {
                            modifier = appendModifier(modifier, node, prop, value, ctx);
                        }
                    }
                }
            } catch (UnsupportedPropError e) {
                diagnostics.report(e.diagnostic().withComponent(node.tag(), name));
            }
        }
        if (hasModifier) {
            arguments.add(new Argument("modifier", modifier));
        }
        return new LoweredProps(arguments, leading);
    }

    /**
     * Lowers the props of a user component: every prop becomes a named argument.
     *
     * @param node markup node
     * @param ctx transform context
     * @param slots lowering for markup values
     * @return arguments
     */
    public LoweredProps lowerUserComponent(MarkupNode node, TransformContext ctx, SlotLowering slots) {
        List<Argument> arguments = new ArrayList<>();
        for (Map.Entry<String, PropValue> entry : node.props().entrySet()) {
            arguments.add(new Argument(entry.getKey(), passThrough(entry.getValue(), ctx, slots)));
        }
        return new LoweredProps(arguments, List.of());
    }

    private Argument undeclared(MarkupNode node, String name, PropValue value, TransformContext ctx, SlotLowering slots) {
        if (strict) {
            throw unsupported(ctx, node, "Component " + node.tag() + " has no prop '" + name + "'");
        }
        diagnostics.report(Diagnostic.warning(DiagnosticKind.UNSUPPORTED_PROP, ctx.fileName(), node.position(),
            "Component " + node.tag() + " has no prop '" + name + "'; passing it through unchanged")
            .withComponent(node.tag(), name));
        log.debug("Passing undeclared prop {}.{} through", node.tag(), name);
        return new Argument(name, passThrough(value, ctx, slots));
    }

    private ExprNode passThrough(PropValue value, TransformContext ctx, SlotLowering slots) {
        if (value instanceof PropValue.Literal literal) {
            return literal.value() instanceof Boolean b ? Literal.bool(b) : Literal.string(literal.value().toString());
        }
        if (value instanceof PropValue.Expression expression) {
            return expressions.transform(expression.expression(), ctx);
        }
        if (value instanceof PropValue.Lambda lambda) {
            return expressions.transform(lambda.lambda(), ctx);
        }
        return ContentLambda.of(slots.lower(((PropValue.Markup) value).node()));
    }

    private ExprNode plain(MarkupNode node, PropSpec prop, PropValue value, TransformContext ctx) {
        if (value instanceof PropValue.Literal literal) {
            if (literal.value() instanceof Boolean b) {
                return Literal.bool(b);
            }
            String text = literal.value().toString();
            return ValueFormatter.fromText(prop.format(), text)
                .orElseThrow(() -> invalidValue(ctx, node, prop, text));
        }
        if (value instanceof PropValue.Expression expression) {
            ExprNode transformed = expressions.transform(expression.expression(), ctx);
            return ValueFormatter.fromExpression(prop.format(), transformed)
                .orElseThrow(() -> invalidValue(ctx, node, prop, describe(expression.expression())));
        }
        if (value instanceof PropValue.Lambda lambda) {
            return expressions.transform(lambda.lambda(), ctx);
        }
        throw unsupported(ctx, node, "Prop '" + prop.name() + "' of " + node.tag() + " does not accept markup");
    }

    private ExprNode slot(MarkupNode node, PropSpec prop, PropValue value, TransformContext ctx, SlotLowering slots) {
        if (value instanceof PropValue.Markup markup) {
            return ContentLambda.of(slots.lower(markup.node()));
        }
        if (value instanceof PropValue.Literal literal) {
            if (literal.value() instanceof Boolean) {
                throw unsupported(ctx, node, "Slot '" + prop.name() + "' of " + node.tag() + " needs content, not a flag");
            }
            return ContentLambda.of(List.of(text(Literal.string(literal.value().toString()))));
        }
        if (value instanceof PropValue.Expression expression) {
            ExprNode transformed = expressions.transform(expression.expression(), ctx);
            if (transformed instanceof Lambda || transformed instanceof ContentLambda) {
                return transformed;
            }
            // Any other value is shown as text
            return ContentLambda.of(List.of(text(transformed)));
        }
        return expressions.transform(((PropValue.Lambda) value).lambda(), ctx);
    }

    private ExprNode callback(MarkupNode node, PropSpec prop, PropValue value, TransformContext ctx) {
        if (value instanceof PropValue.Lambda lambda) {
            if (lambda.lambda().parameters().size() > prop.arity()) {
                throw unsupported(ctx, node, "Callback '" + prop.name() + "' of " + node.tag() + " takes "
                    + prop.arity() + " parameter(s) but the lambda declares " + lambda.lambda().parameters().size());
            }
            return expressions.transform(lambda.lambda(), ctx);
        }
        if (value instanceof PropValue.Expression expression) {
            ExprNode expr = expression.expression();
            Lambda wrapped;
            if (expr instanceof Identifier || expr instanceof MemberAccess) {
                wrapped = invoke(expr, prop.arity());
            } else {
                wrapped = new Lambda(List.of(), List.of(expr), false);
            }
            return expressions.transform(wrapped, ctx);
        }
        throw unsupported(ctx, node, "Callback '" + prop.name() + "' of " + node.tag() + " needs a lambda or a function reference");
    }

    private List<Argument> binding(MarkupNode node, PropSpec prop, PropValue value, TransformContext ctx) {
        if (!(value instanceof PropValue.Expression expression)
            || !(expression.expression() instanceof Identifier || expression.expression() instanceof MemberAccess)) {
            throw unsupported(ctx, node, "'" + prop.name() + "' needs a variable, such as " + prop.name() + "={name}");
        }
        ExprNode target = expression.expression();
        String parser = TypeInference.numericParser(bindingType(target, ctx));

        ExprNode shown = parser != null
            ? new Call(new MemberAccess(target, "toString", false), null, List.of(), null)
            : target;
        ExprNode incoming = new Identifier("it");
        if (parser != null) {
            incoming = new BinaryOp(new Call(new MemberAccess(incoming, parser, false), null, List.of(), null), "?:", target);
        }
        Lambda onChange = new Lambda(List.of(), List.of(new Assignment(target, "=", incoming, node.position())), false);
        return List.of(
            new Argument(prop.target(), expressions.transform(shown, ctx)),
            new Argument(prop.callback(), expressions.transform(onChange, ctx)));
    }

    private ExprNode textValue(MarkupNode node, PropSpec prop, PropValue value, TransformContext ctx) {
        if (value instanceof PropValue.Literal literal && literal.value() instanceof String s) {
            return Literal.string(s);
        }
        if (value instanceof PropValue.Expression expression) {
            return expressions.transform(expression.expression(), ctx);
        }
        throw unsupported(ctx, node, "'" + prop.name() + "' of " + node.tag() + " needs text");
    }

    private ExprNode modifierBase(MarkupNode node, TransformContext ctx) {
        PropValue explicit = node.props().get("modifier");
        if (explicit instanceof PropValue.Expression expression) {
            return expressions.transform(expression.expression(), ctx);
        }
        if (explicit != null) {
            throw unsupported(ctx, node, "'modifier' of " + node.tag() + " needs an expression, such as modifier={Modifier}");
        }
        return new Identifier("Modifier");
    }

    private ExprNode appendModifier(ExprNode chain, MarkupNode node, PropSpec prop, PropValue value, TransformContext ctx) {
        String function = prop.target();
        if (prop.format() == ValueFormat.FLAG) {
            if (value instanceof PropValue.Literal literal) {
                boolean on = literal.value() instanceof Boolean b ? b : Boolean.parseBoolean(literal.value().toString());
                return on ? call(new MemberAccess(chain, function, false)) : chain;
            }
            if (value instanceof PropValue.Expression expression) {
                ExprNode condition = expressions.transform(expression.expression(), ctx);
                ExprNode applied = call(new MemberAccess(new Identifier("Modifier"), function, false));
                return call(new MemberAccess(chain, "then", false),
                    new Conditional(condition, List.of(applied), List.of(new Identifier("Modifier"))));
            }
            throw unsupported(ctx, node, "'" + prop.name() + "' of " + node.tag() + " is a flag");
        }
        return call(new MemberAccess(chain, function, false), plain(node, prop, value, ctx));
    }

    private StateVar stateFor(ExprNode target, TransformContext ctx) {
        if (target instanceof Identifier id) {
            return ctx.symbols().localState().get(id.name());
        }
        if (target instanceof MemberAccess access && access.target() instanceof Identifier id) {
            return ctx.symbols().binding(id.name())
                .map(binding -> binding.store().field(access.member()))
                .orElse(null);
        }
        return null;
    }

    private String bindingType(ExprNode target, TransformContext ctx) {
        StateVar state = stateFor(target, ctx);
        return state != null ? TypeInference.typeOf(state).orElse(null) : null;
    }

    private static Lambda invoke(ExprNode reference, int arity) {
        if (arity == 0) {
            return new Lambda(List.of(), List.of(call(reference)), false);
        }
        if (arity == 1) {
            return new Lambda(List.of(), List.of(call(reference, new Identifier("it"))), false);
        }
        List<String> parameters = IntStream.rangeClosed(1, arity).mapToObj(i -> "p" + i).toList();
        ExprNode[] arguments = parameters.stream().map(Identifier::new).toArray(ExprNode[]::new);
        return new Lambda(parameters, List.of(call(reference, arguments)), false);
    }

    private static UiNode text(ExprNode content) {
        return new UiNode.ComponentCall("Text", List.of(new Argument("text", content)), null);
    }

    private static Call call(ExprNode callee, ExprNode... arguments) {
        return new Call(callee, null, Arrays.stream(arguments).map(Argument::positional).toList(), null);
    }

    private static String describe(ExprNode expr) {
        return expr instanceof Literal literal ? literal.text() : expr.getClass().getSimpleName();
    }

    private static UnsupportedPropError invalidValue(TransformContext ctx, MarkupNode node, PropSpec prop, String text) {
        return unsupported(ctx, node, "Invalid value '" + text + "' for " + node.tag() + "." + prop.name()
            + " (expected " + prop.format().name().toLowerCase().replace('_', ' ') + ")");
    }

    private static UnsupportedPropError unsupported(TransformContext ctx, MarkupNode node, String message) {
        return new UnsupportedPropError(ctx.fileName(), node.position(), message);
    }
}
