package com.whitehall.core.diagnostic;

/**
 * Category of a diagnostic, one per error class of the compiler.
 */
public enum DiagnosticKind {
    SYNTAX_ERROR(true),
    UNRESOLVED_COMPONENT(false),
    UNSUPPORTED_PROP(false),
    NAME_CONFLICT(false),
    SCOPE_VIOLATION(true),
    TYPE_INFERENCE(true),
    STYLE_HINT(false);

    private final boolean aborting;

    DiagnosticKind(boolean aborting) {
        this.aborting = aborting;
    }

    /**
     * Whether the compiler stops processing the file at the first occurrence.
     *
     * @return true for kinds thrown rather than collected
     */
    public boolean isAborting() {
        return aborting;
    }
}
