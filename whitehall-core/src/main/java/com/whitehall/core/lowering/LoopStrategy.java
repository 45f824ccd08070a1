package com.whitehall.core.lowering;

/**
 * How an {@code @for} directive is lowered.
 *
 * <p>The choice depends on the enclosing container only. There is no size or complexity heuristic
 * and no adapter-based fallback.
 */
public enum LoopStrategy {
    /** {@code items(iterable) { item -> }} in a lazy list scope */
    LAZY_ITEMS,
    /** {@code iterable.forEach { item -> }} emitting one subtree per element */
    INLINE_REPETITION;

    /**
     * Selects the strategy for a container.
     *
     * @param container enclosing container kind
     * @return the strategy; total over all kinds
     */
    public static LoopStrategy forContainer(ContainerKind container) {
        return switch (container) {
            case LAZY -> LAZY_ITEMS;
            case LAYOUT -> INLINE_REPETITION;
        };
    }
}
