package com.whitehall.core.lowering;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Conditional;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.IndexAccess;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.ExprNode.Parenthesized;
import com.whitehall.core.ast.ExprNode.Segment;
import com.whitehall.core.ast.ExprNode.StringInterpolation;
import com.whitehall.core.ast.ExprNode.UnaryOp;

import java.util.List;

/**
 * Replaces free occurrences of one identifier. Nested lambdas are left alone since they may
 * shadow the name.
 */
final class IdentifierRenamer {

    private IdentifierRenamer() {
        // Utility class - no instantiation
    }

    static ExprNode rename(ExprNode expr, String from, String to) {
        if (expr instanceof Identifier id) {
            return id.name().equals(from) ? new Identifier(to) : id;
        }
        if (expr instanceof MemberAccess access) {
            return new MemberAccess(rename(access.target(), from, to), access.member(), access.safe());
        }
        if (expr instanceof Call call) {
            List<Argument> arguments = call.arguments().stream()
                .map(a -> new Argument(a.name(), rename(a.value(), from, to)))
                .toList();
            return new Call(rename(call.callee(), from, to), call.typeArguments(), arguments, call.trailingLambda());
        }
        if (expr instanceof BinaryOp binary) {
            return new BinaryOp(rename(binary.left(), from, to), binary.operator(), rename(binary.right(), from, to));
        }
        if (expr instanceof UnaryOp unary) {
            return new UnaryOp(unary.operator(), rename(unary.operand(), from, to), unary.postfix());
        }
        if (expr instanceof IndexAccess index) {
            return new IndexAccess(rename(index.target(), from, to), rename(index.index(), from, to));
        }
        if (expr instanceof Parenthesized parenthesized) {
            return new Parenthesized(rename(parenthesized.inner(), from, to));
        }
        if (expr instanceof Conditional conditional) {
            return new Conditional(rename(conditional.condition(), from, to),
                conditional.thenBody().stream().map(e -> rename(e, from, to)).toList(),
                conditional.elseBody().stream().map(e -> rename(e, from, to)).toList());
        }
        if (expr instanceof StringInterpolation interpolation) {
            return new StringInterpolation(interpolation.segments().stream()
                .map(s -> s.isText() ? s : Segment.expr(rename(s.expression(), from, to)))
                .toList());
        }
        return expr;
    }
}
