package com.whitehall.core.ast;

import java.util.Objects;

/**
 * Function or prop parameter.
 *
 * @param name parameter name
 * @param type declared type text, or null when omitted
 * @param defaultValue default value source text, or null when absent
 */
public record Parameter(String name, String type, String defaultValue) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Renders the parameter as it appears in a Kotlin signature.
     *
     * @return {@code name: Type = default}
     */
    public String toSignature() {
        StringBuilder sb = new StringBuilder(name);
        if (type != null) {
            sb.append(": ").append(type);
        }
        if (defaultValue != null) {
            sb.append(" = ").append(defaultValue);
        }
        return sb.toString();
    }
}
