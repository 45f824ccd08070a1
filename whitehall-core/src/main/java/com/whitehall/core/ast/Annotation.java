package com.whitehall.core.ast;

import java.util.Objects;

/**
 * Annotation attached to a top-level declaration, such as {@code @store} or {@code @ffi("rust")}.
 *
 * @param name annotation name without the leading {@code @}
 * @param arguments raw argument text between the parentheses, or null when absent
 */
public record Annotation(String name, String arguments) {

    public Annotation {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns the first string literal in the arguments, without quotes.
     *
     * @return unquoted argument, or null if there is none
     */
    public String stringArgument() {
        if (arguments == null) {
            return null;
        }
        int open = arguments.indexOf('"');
        int close = arguments.indexOf('"', open + 1);
        if (open < 0 || close < 0) {
            return arguments.isBlank() ? null : arguments.trim();
        }
        return arguments.substring(open + 1, close);
    }
}
