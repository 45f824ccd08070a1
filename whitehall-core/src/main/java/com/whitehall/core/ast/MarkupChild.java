package com.whitehall.core.ast;

/**
 * Child of a markup node: a nested {@link MarkupNode}, a {@link TextSegment} or a {@link ControlDirective}.
 */
public interface MarkupChild {

    SourcePosition position();
}
