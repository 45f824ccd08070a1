package com.whitehall.core.diagnostic;

import com.whitehall.core.ast.SourcePosition;

/**
 * Markup names a component that is neither registered, declared in the file, nor imported.
 */
public final class UnresolvedComponentError extends CompileException {

    private static final long serialVersionUID = 1L;

    public UnresolvedComponentError(Diagnostic diagnostic) {
        super(diagnostic);
    }

    public UnresolvedComponentError(String file, SourcePosition position, String message) {
        this(Diagnostic.error(DiagnosticKind.UNRESOLVED_COMPONENT, file, position, message));
    }
}
