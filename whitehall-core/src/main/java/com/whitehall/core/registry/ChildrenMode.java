package com.whitehall.core.registry;

/**
 * What a component does with its markup children.
 */
public enum ChildrenMode {
    /** Children are not accepted */
    NONE,
    /** Children go into a trailing composable content lambda */
    CONTENT,
    /** Content lambda that receives {@code paddingValues}, as {@code Scaffold} does */
    PADDED_CONTENT,
    /** Lazy list scope: children become {@code item}/{@code items} builder calls */
    LAZY,
    /** Children are text and become the {@code text} argument */
    TEXT
}
