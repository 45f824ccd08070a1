package com.whitehall.core.ast;

/**
 * One-based line and column of a construct in the source text.
 *
 * @param line line number (1-indexed)
 * @param column column number (1-indexed)
 */
public record SourcePosition(int line, int column) {

    /** Position used for synthesized nodes that have no source location. */
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
