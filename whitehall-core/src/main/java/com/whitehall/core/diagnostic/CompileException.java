package com.whitehall.core.diagnostic;

/**
 * Abstract base for compiler errors. Never thrown directly; use the concrete subclasses.
 *
 * <p>Every exception carries the {@link Diagnostic} that describes it, so a caller that catches
 * it can report the error in the same form as collected diagnostics.
 */
public abstract class CompileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Diagnostic diagnostic;

    protected CompileException(Diagnostic diagnostic) {
        super(diagnostic.format());
        this.diagnostic = diagnostic;
    }

    /** The diagnostic describing this error. */
    public Diagnostic diagnostic() {
        return diagnostic;
    }
}
