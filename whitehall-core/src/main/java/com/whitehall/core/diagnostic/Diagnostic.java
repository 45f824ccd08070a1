package com.whitehall.core.diagnostic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whitehall.core.ast.SourcePosition;

import java.util.Objects;

/**
 * Structured compiler message.
 *
 * @param severity error or warning
 * @param kind diagnostic category
 * @param file source file name
 * @param line line (1-indexed, 0 when unknown)
 * @param column column (1-indexed, 0 when unknown)
 * @param message human-readable description
 * @param componentName offending component, or null
 * @param propName offending prop, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
    Severity severity,
    DiagnosticKind kind,
    String file,
    int line,
    int column,
    String message,
    String componentName,
    String propName
) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic error(DiagnosticKind kind, String file, SourcePosition position, String message) {
        return new Diagnostic(Severity.ERROR, kind, file, position.line(), position.column(), message, null, null);
    }

    public static Diagnostic warning(DiagnosticKind kind, String file, SourcePosition position, String message) {
        return new Diagnostic(Severity.WARNING, kind, file, position.line(), position.column(), message, null, null);
    }

    /**
     * Returns a copy naming the offending component and prop.
     *
     * @param component component name
     * @param prop prop name, may be null
     * @return new diagnostic
     */
    public Diagnostic withComponent(String component, String prop) {
        return new Diagnostic(severity, kind, file, line, column, message, component, prop);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Formats the diagnostic as {@code file:line:column: severity: message}.
     *
     * @return single-line rendering
     */
    public String format() {
        return String.format("%s:%d:%d: %s: %s", file, line, column, severity.name().toLowerCase(), message);
    }
}
