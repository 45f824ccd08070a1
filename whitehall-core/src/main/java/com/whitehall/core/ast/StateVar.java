package com.whitehall.core.ast;

import java.util.Objects;

/**
 * A {@code var} or {@code val} declared in a component script or a store.
 *
 * @param name variable name
 * @param type declared type text, or null when it must be inferred
 * @param initializer initial value; for derived and computed values, the defining expression
 * @param mutable true for {@code var}
 * @param scope owning scope
 * @param kind plain, derived ({@code $derived(expr)}) or computed ({@code get() = expr})
 * @param privateMember true when declared {@code private} inside a store
 * @param position source location
 */
public record StateVar(
    String name,
    String type,
    ExprNode initializer,
    boolean mutable,
    StateScope scope,
    Kind kind,
    boolean privateMember,
    SourcePosition position
) implements Declaration {

    /**
     * How the value of a state variable is produced.
     */
    public enum Kind {
        /** Holds a value assigned at declaration and by later writes */
        PLAIN,
        /** {@code $derived(expr)} */
        DERIVED,
        /** {@code get() = expr} */
        COMPUTED
    }

    public StateVar {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    /**
     * Whether writes to this variable are legal and routed through an update method.
     *
     * @return true for plain {@code var}s
     */
    public boolean isWritable() {
        return mutable && kind == Kind.PLAIN;
    }
}
