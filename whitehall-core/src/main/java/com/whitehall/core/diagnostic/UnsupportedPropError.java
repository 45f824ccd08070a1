package com.whitehall.core.diagnostic;

import com.whitehall.core.ast.SourcePosition;

/**
 * A registered component received a prop it does not declare, or a value it cannot lower.
 */
public final class UnsupportedPropError extends CompileException {

    private static final long serialVersionUID = 1L;

    public UnsupportedPropError(Diagnostic diagnostic) {
        super(diagnostic);
    }

    public UnsupportedPropError(String file, SourcePosition position, String message) {
        this(Diagnostic.error(DiagnosticKind.UNSUPPORTED_PROP, file, position, message));
    }
}
