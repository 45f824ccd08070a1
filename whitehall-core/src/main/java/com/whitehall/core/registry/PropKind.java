package com.whitehall.core.registry;

/**
 * How a component prop is lowered.
 */
public enum PropKind {
    /** Passed through as a named argument after value formatting */
    PLAIN,
    /** Content slot; markup and string values are wrapped in a zero-argument lambda */
    COMPOSABLE_SLOT,
    /** Appended to the component's {@code Modifier} chain */
    MODIFIER_CHAIN,
    /** Event handler lambda with a fixed parameter count */
    CALLBACK,
    /** Two-way binding that expands to a value argument plus a change callback */
    BINDING,
    /** Rendered as a {@code Text} child of the component's content */
    CHILD_TEXT
}
