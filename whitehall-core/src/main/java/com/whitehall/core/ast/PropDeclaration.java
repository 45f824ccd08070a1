package com.whitehall.core.ast;

import java.util.Objects;

/**
 * {@code @prop val name: Type = default} - a parameter of the file's main entry point.
 *
 * @param parameter the declared parameter
 * @param position source location
 */
public record PropDeclaration(Parameter parameter, SourcePosition position) implements Declaration {

    public PropDeclaration {
        Objects.requireNonNull(parameter, "parameter must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
