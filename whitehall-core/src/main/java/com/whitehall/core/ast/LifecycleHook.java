package com.whitehall.core.ast;

import java.util.Objects;

/**
 * {@code $onMount { }} or {@code $onDispose { }} of the main entry point.
 *
 * @param kind hook kind
 * @param code verbatim body text
 * @param position source location
 */
public record LifecycleHook(Kind kind, CodeBlock code, SourcePosition position) implements Declaration {

    public enum Kind { MOUNT, DISPOSE }

    public LifecycleHook {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
