package com.whitehall.core.ast;

import java.util.Objects;

/**
 * Run of markup text and {@code {expr}} interpolations between tags.
 *
 * @param content the text with whitespace collapsed
 * @param position location of the first character
 */
public record TextSegment(ExprNode.StringInterpolation content, SourcePosition position) implements MarkupChild {

    public TextSegment {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
