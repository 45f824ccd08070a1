package com.whitehall.core.transform;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.ArrayLiteral;
import com.whitehall.core.ast.ExprNode.Assignment;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Conditional;
import com.whitehall.core.ast.ExprNode.Dispatch;
import com.whitehall.core.ast.ExprNode.Dispatcher;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.IndexAccess;
import com.whitehall.core.ast.ExprNode.Lambda;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.LocalVariable;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.ExprNode.Parenthesized;
import com.whitehall.core.ast.ExprNode.Segment;
import com.whitehall.core.ast.ExprNode.StringInterpolation;
import com.whitehall.core.ast.ExprNode.Ternary;
import com.whitehall.core.ast.ExprNode.UnaryOp;
import com.whitehall.core.ast.SourcePosition;
import com.whitehall.core.ast.StateScope;
import com.whitehall.core.ast.StateVar;
import com.whitehall.core.ast.StoreClass;
import com.whitehall.core.diagnostic.ScopeViolationError;

import java.util.List;

/**
 * Pure rewrites of expression trees into their Kotlin forms.
 *
 * <ul>
 *   <li>ternaries become {@code if} expressions, also inside every interpolation segment;</li>
 *   <li>arrow lambdas become brace lambdas for any parameter count;</li>
 *   <li>array literals become {@code listOf(...)};</li>
 *   <li>{@code io { }}, {@code cpu { }} and {@code main { }} become scoped launches;</li>
 *   <li>reads of {@code store.field} in a component go through the collected snapshot;</li>
 *   <li>writes to store fields become calls of the store's update method.</li>
 * </ul>
 *
 * <p>Illegal writes throw {@link ScopeViolationError}. Input trees are never modified.
 */
public final class ExpressionTransformer {

    /**
     * Name of the update method generated for a store field.
     *
     * @param field field name
     * @return {@code updateField}
     */
    public static String updateMethodName(String field) {
        return "update" + Character.toUpperCase(field.charAt(0)) + field.substring(1);
    }

    /**
     * Transforms an expression or statement.
     *
     * @param expr source tree
     * @param ctx transform context
     * @return new tree
     */
    public ExprNode transform(ExprNode expr, TransformContext ctx) {
        if (expr instanceof Ternary ternary) {
            return new Conditional(
                transform(ternary.condition(), ctx),
                List.of(transform(ternary.thenExpr(), ctx)),
                List.of(transform(ternary.elseExpr(), ctx)));
        }
        if (expr instanceof StringInterpolation interpolation) {
            TransformContext inner = ctx.withInterpolation(true);
            return new StringInterpolation(interpolation.segments().stream()
                .map(s -> s.isText() ? s : Segment.expr(transform(s.expression(), inner)))
                .toList());
        }
        if (expr instanceof Lambda lambda) {
            return new Lambda(lambda.parameters(), transformAll(lambda.body(), ctx.withInterpolation(false)), false);
        }
        if (expr instanceof ArrayLiteral array) {
            return new Call(new Identifier("listOf"), null,
                array.elements().stream().map(e -> Argument.positional(transform(e, ctx))).toList(), null);
        }
        if (expr instanceof Call call) {
            return transformCall(call, ctx);
        }
        if (expr instanceof MemberAccess access) {
            return transformRead(access, ctx);
        }
        if (expr instanceof Assignment assignment) {
            return transformAssignment(assignment, ctx);
        }
        if (expr instanceof UnaryOp unary) {
            return transformUnary(unary, ctx);
        }
        if (expr instanceof BinaryOp binary) {
            return new BinaryOp(transform(binary.left(), ctx), binary.operator(), transform(binary.right(), ctx));
        }
        if (expr instanceof Conditional conditional) {
            return new Conditional(
                transform(conditional.condition(), ctx),
                transformAll(conditional.thenBody(), ctx),
                transformAll(conditional.elseBody(), ctx));
        }
        if (expr instanceof IndexAccess index) {
            return new IndexAccess(transform(index.target(), ctx), transform(index.index(), ctx));
        }
        if (expr instanceof Parenthesized parenthesized) {
            return new Parenthesized(transform(parenthesized.inner(), ctx));
        }
        if (expr instanceof LocalVariable local) {
            return new LocalVariable(local.mutable(), local.name(), local.type(), transform(local.initializer(), ctx));
        }
        if (expr instanceof Dispatch dispatch) {
            return new Dispatch(dispatch.dispatcher(), dispatch.scope(), transformAll(dispatch.body(), ctx));
        }
        // Identifiers, literals and already lowered nodes
        return expr;
    }

    public List<ExprNode> transformAll(List<ExprNode> statements, TransformContext ctx) {
        return statements.stream().map(s -> transform(s, ctx)).toList();
    }

    private ExprNode transformCall(Call call, TransformContext ctx) {
        if (call.callee() instanceof Identifier id && call.arguments().isEmpty() && call.typeArguments() == null
            && call.trailingLambda() != null && call.trailingLambda().parameters().isEmpty()) {
            Dispatcher dispatcher = Dispatcher.fromKeyword(id.name());
            if (dispatcher != null) {
                return new Dispatch(dispatcher, ctx.symbols().dispatchScope(),
                    transformAll(call.trailingLambda().body(), ctx.withInterpolation(false)));
            }
        }
        List<Argument> arguments = call.arguments().stream()
            .map(a -> new Argument(a.name(), transform(a.value(), ctx)))
            .toList();
        Lambda trailing = call.trailingLambda() != null ? (Lambda) transform(call.trailingLambda(), ctx) : null;
        return new Call(transform(call.callee(), ctx), call.typeArguments(), arguments, trailing);
    }

    private ExprNode transformRead(MemberAccess access, TransformContext ctx) {
        if (access.target() instanceof Identifier id) {
            StoreBinding binding = ctx.symbols().binding(id.name()).orElse(null);
            if (binding != null) {
                StateVar field = binding.store().field(access.member());
                if (field != null && field.privateMember()) {
                    throw new ScopeViolationError(ctx.fileName(), field.position(),
                        "'" + access.member() + "' is private to store " + binding.store().name());
                }
                if (field != null) {
                    return new MemberAccess(new Identifier(binding.stateName()), access.member(), access.safe());
                }
                return access;
            }
        }
        return new MemberAccess(transform(access.target(), ctx), access.member(), access.safe());
    }

    private ExprNode transformUnary(UnaryOp unary, TransformContext ctx) {
        boolean increment = unary.operator().equals("++") || unary.operator().equals("--");
        if (increment) {
            if (ctx.insideInterpolation()) {
                throw new ScopeViolationError(ctx.fileName(), SourcePosition.UNKNOWN,
                    "State cannot be modified inside a text interpolation");
            }
            if (storeField(unary.operand(), SourcePosition.UNKNOWN, ctx) != null) {
                String operator = unary.operator().equals("++") ? "+=" : "-=";
                return transformAssignment(
                    new Assignment(unary.operand(), operator, Literal.number("1"), SourcePosition.UNKNOWN), ctx);
            }
            return new UnaryOp(unary.operator(), transformTarget(unary.operand(), ctx), unary.postfix());
        }
        return new UnaryOp(unary.operator(), transform(unary.operand(), ctx), unary.postfix());
    }

    private ExprNode transformAssignment(Assignment assignment, TransformContext ctx) {
        if (ctx.insideInterpolation()) {
            throw new ScopeViolationError(ctx.fileName(), assignment.position(),
                "State cannot be assigned inside a text interpolation");
        }
        checkSnapshotWrite(assignment.target(), assignment.position(), ctx);

        StoreTarget target = storeField(assignment.target(), assignment.position(), ctx);
        if (target == null) {
            checkInPlaceMutation(assignment.target(), assignment.position(), ctx);
            checkLocalWrite(assignment.target(), assignment.position(), ctx);
            return new Assignment(transformTarget(assignment.target(), ctx), assignment.operator(),
                transform(assignment.value(), ctx), assignment.position());
        }

        StateVar field = target.field();
        if (field.privateMember()) {
            if (target.receiver() != null) {
                throw new ScopeViolationError(ctx.fileName(), assignment.position(),
                    "'" + field.name() + "' is private to store " + target.store().name());
            }
            // Private members are plain fields of the store and are written directly
            return new Assignment(assignment.target(), assignment.operator(),
                transform(assignment.value(), ctx), assignment.position());
        }
        if (!field.isWritable()) {
            throw new ScopeViolationError(ctx.fileName(), assignment.position(),
                "Cannot assign to '" + field.name() + "' of store " + target.store().name()
                    + ": it is " + describeReadOnly(field));
        }

        ExprNode value = transform(assignment.value(), ctx);
        if (!assignment.operator().equals("=")) {
            ExprNode current = target.receiver() != null
                ? new MemberAccess(target.receiver(), field.name(), false)
                : new Identifier(field.name());
            String operator = assignment.operator().substring(0, assignment.operator().length() - 1);
            value = new BinaryOp(current, operator, value);
        }
        String update = updateMethodName(field.name());
        if (target.receiver() == null && update.equals(ctx.enclosingFunction())) {
            // Inside the author's own update method: write the container directly
            return directUpdate(target.store(), field.name(), value);
        }
        ExprNode callee = target.receiver() != null
            ? new MemberAccess(target.receiver(), update, false)
            : new Identifier(update);
        return new Call(callee, null, List.of(Argument.positional(value)), null);
    }

    private static ExprNode directUpdate(StoreClass store, String field, ExprNode value) {
        String flow = store.singleton() ? "_state" : "_uiState";
        Call copy = new Call(new MemberAccess(new Identifier("it"), "copy", false), null,
            List.of(new Argument(field, value)), null);
        return new Call(new MemberAccess(new Identifier(flow), "update", false), null, List.of(),
            new Lambda(List.of(), List.of(copy), false));
    }

    /**
     * Transforms an assignment target; unlike reads, store bindings are left in place.
     */
    private ExprNode transformTarget(ExprNode target, TransformContext ctx) {
        if (target instanceof MemberAccess access) {
            return new MemberAccess(transformTarget(access.target(), ctx), access.member(), access.safe());
        }
        if (target instanceof IndexAccess index) {
            return new IndexAccess(transformTarget(index.target(), ctx), transform(index.index(), ctx));
        }
        return target;
    }

    /**
     * Resolves a target naming a store field: {@code binding.field} in a component, or
     * {@code field} / {@code this.field} inside the store.
     */
    private StoreTarget storeField(ExprNode target, SourcePosition position, TransformContext ctx) {
        if (target instanceof MemberAccess access && access.target() instanceof Identifier id) {
            StoreBinding binding = ctx.symbols().binding(id.name()).orElse(null);
            if (binding != null) {
                StateVar field = binding.store().field(access.member());
                if (field == null) {
                    throw new ScopeViolationError(ctx.fileName(), position,
                        "'" + access.member() + "' is not a state field of store " + binding.store().name());
                }
                return new StoreTarget(binding.store(), field, id);
            }
            if (id.name().equals("this") && ctx.owningScope() == StateScope.STORE) {
                StateVar field = ctx.symbols().currentStore().field(access.member());
                return field != null ? new StoreTarget(ctx.symbols().currentStore(), field, null) : null;
            }
        }
        if (target instanceof Identifier id && ctx.owningScope() == StateScope.STORE
            && ctx.symbols().currentStore() != null) {
            StateVar field = ctx.symbols().currentStore().field(id.name());
            return field != null ? new StoreTarget(ctx.symbols().currentStore(), field, null) : null;
        }
        return null;
    }

    private void checkSnapshotWrite(ExprNode target, SourcePosition position, TransformContext ctx) {
        Identifier root = root(target);
        if (root == null) {
            return;
        }
        ctx.symbols().bindingForState(root.name()).ifPresent(binding -> {
            throw new ScopeViolationError(ctx.fileName(), position,
                "Cannot write through the state snapshot '" + root.name() + "'; assign a field of '"
                    + binding.name() + "' instead");
        });
    }

    private void checkInPlaceMutation(ExprNode target, SourcePosition position, TransformContext ctx) {
        if (target instanceof Identifier) {
            return;
        }
        Identifier root = root(target);
        if (root == null) {
            return;
        }
        String field = null;
        StoreClass store = null;
        if (ctx.symbols().binding(root.name()).isPresent()) {
            store = ctx.symbols().binding(root.name()).get().store();
            field = firstMember(target);
        } else if (ctx.owningScope() == StateScope.STORE && ctx.symbols().currentStore() != null
            && ctx.symbols().currentStore().field(root.name()) != null) {
            store = ctx.symbols().currentStore();
            field = root.name();
        }
        if (store != null) {
            throw new ScopeViolationError(ctx.fileName(), position,
                "Store state '" + field + "' of " + store.name()
                    + " cannot be mutated in place; assign a new value to the field");
        }
    }

    private void checkLocalWrite(ExprNode target, SourcePosition position, TransformContext ctx) {
        if (target instanceof Identifier id && ctx.owningScope() == StateScope.LOCAL) {
            StateVar local = ctx.symbols().localState().get(id.name());
            if (local != null && !local.isWritable()) {
                throw new ScopeViolationError(ctx.fileName(), position,
                    "Cannot assign to '" + id.name() + "': it is " + describeReadOnly(local));
            }
        }
    }

    private static String describeReadOnly(StateVar variable) {
        return switch (variable.kind()) {
            case DERIVED -> "a derived value";
            case COMPUTED -> "a computed value";
            case PLAIN -> "declared with val";
        };
    }

    private static Identifier root(ExprNode target) {
        ExprNode current = target;
        while (true) {
            if (current instanceof MemberAccess access) {
                current = access.target();
            } else if (current instanceof IndexAccess index) {
                current = index.target();
            } else {
                return current instanceof Identifier id ? id : null;
            }
        }
    }

    private static String firstMember(ExprNode target) {
        ExprNode current = target;
        String member = null;
        while (true) {
            if (current instanceof MemberAccess access) {
                member = access.member();
                current = access.target();
            } else if (current instanceof IndexAccess index) {
                current = index.target();
            } else {
                return member;
            }
        }
    }

    private record StoreTarget(StoreClass store, StateVar field, ExprNode receiver) {}
}
