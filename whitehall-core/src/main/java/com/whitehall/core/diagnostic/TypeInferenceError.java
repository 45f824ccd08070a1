package com.whitehall.core.diagnostic;

import com.whitehall.core.ast.SourcePosition;

/**
 * A store field has no declared type and none can be inferred from its initial value.
 */
public final class TypeInferenceError extends CompileException {

    private static final long serialVersionUID = 1L;

    public TypeInferenceError(Diagnostic diagnostic) {
        super(diagnostic);
    }

    public TypeInferenceError(String file, SourcePosition position, String message) {
        this(Diagnostic.error(DiagnosticKind.TYPE_INFERENCE, file, position, message));
    }
}
