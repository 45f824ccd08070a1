package com.whitehall.core.diagnostic;

import com.whitehall.core.ast.SourcePosition;

/**
 * Direct mutation of a store-owned variable outside its update route.
 */
public final class ScopeViolationError extends CompileException {

    private static final long serialVersionUID = 1L;

    public ScopeViolationError(Diagnostic diagnostic) {
        super(diagnostic);
    }

    public ScopeViolationError(String file, SourcePosition position, String message) {
        this(Diagnostic.error(DiagnosticKind.SCOPE_VIOLATION, file, position, message));
    }
}
