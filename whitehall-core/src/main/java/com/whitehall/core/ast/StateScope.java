package com.whitehall.core.ast;

/**
 * Owner of a state variable.
 */
public enum StateScope {
    /** Declared in a component script; lowered to in-place observable local state */
    LOCAL,
    /** Declared inside a store class; lowered to a field of the reactive-state container */
    STORE
}
