package com.whitehall.core.ast;

/**
 * Top-level (or store member) declaration of a source file.
 */
public interface Declaration {

    /**
     * Source location of the declaration keyword.
     *
     * @return position, never null
     */
    SourcePosition position();
}
