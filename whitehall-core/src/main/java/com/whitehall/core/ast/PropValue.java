package com.whitehall.core.ast;

import java.util.Objects;

/**
 * Value bound to a markup prop.
 */
public interface PropValue {

    /** {@code name="text"} or a bare boolean prop; holds a {@link String} or {@link Boolean}. */
    record Literal(Object value) implements PropValue {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** {@code name={expr}} or a quoted value containing {@code {expr}} interpolation. */
    record Expression(ExprNode expression) implements PropValue {
        public Expression {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    /** {@code name={<Comp/>}}. */
    record Markup(MarkupNode node) implements PropValue {
        public Markup {
            Objects.requireNonNull(node, "node must not be null");
        }
    }

    /** {@code name={(a) => body}} or {@code name={{ a -> body }}}. */
    record Lambda(ExprNode.Lambda lambda) implements PropValue {
        public Lambda {
            Objects.requireNonNull(lambda, "lambda must not be null");
        }
    }
}
