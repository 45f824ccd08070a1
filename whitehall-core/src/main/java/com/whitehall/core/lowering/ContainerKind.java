package com.whitehall.core.lowering;

/**
 * Syntactic kind of the container enclosing a markup child.
 */
public enum ContainerKind {
    /** Scrolling list with an item builder scope, such as {@code LazyColumn} */
    LAZY,
    /** Any other layout, a content slot, or the top level of a composable */
    LAYOUT
}
