package com.whitehall.core.diagnostic;

import com.whitehall.core.ast.SourcePosition;

/**
 * Source text could not be parsed. Aborts the file's compile immediately.
 */
public final class SyntaxError extends CompileException {

    private static final long serialVersionUID = 1L;

    public SyntaxError(Diagnostic diagnostic) {
        super(diagnostic);
    }

    public SyntaxError(String file, SourcePosition position, String message) {
        this(Diagnostic.error(DiagnosticKind.SYNTAX_ERROR, file, position, message));
    }
}
