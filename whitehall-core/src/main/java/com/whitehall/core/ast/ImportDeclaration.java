package com.whitehall.core.ast;

import java.util.Objects;

/**
 * {@code import path [as Alias]}.
 *
 * @param path dotted path as written; may start with {@code $}
 * @param alias alias name, or null
 * @param position source location
 */
public record ImportDeclaration(String path, String alias, SourcePosition position) implements Declaration {

    public ImportDeclaration {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    /**
     * Name the import binds in the file: the alias or the last path segment.
     *
     * @return simple name
     */
    public String simpleName() {
        if (alias != null) {
            return alias;
        }
        int dot = path.lastIndexOf('.');
        return dot >= 0 ? path.substring(dot + 1) : path;
    }

    /**
     * Resolves a leading {@code $} against the base package.
     *
     * @param basePackage configured base package
     * @return fully qualified import path
     */
    public String resolve(String basePackage) {
        if (path.startsWith("$")) {
            String rest = path.substring(1);
            if (rest.startsWith(".")) {
                rest = rest.substring(1);
            }
            return rest.isEmpty() ? basePackage : basePackage + "." + rest;
        }
        return path;
    }
}
