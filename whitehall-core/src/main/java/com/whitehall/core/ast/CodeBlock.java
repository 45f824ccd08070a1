package com.whitehall.core.ast;

import java.util.Objects;

/**
 * Verbatim code kept without deep parsing, such as a plain function body.
 *
 * @param text code between the enclosing braces
 * @param start position of the first character of {@code text}
 */
public record CodeBlock(String text, SourcePosition start) {

    public CodeBlock {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(start, "start must not be null");
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
