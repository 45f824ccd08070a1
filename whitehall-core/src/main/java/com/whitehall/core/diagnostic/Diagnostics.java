package com.whitehall.core.diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics collected while compiling one file.
 *
 * <p>An instance belongs to a single compile call and is never shared between files.
 */
public final class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        entries.add(diagnostic);
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(Diagnostic::isError);
    }

    public List<Diagnostic> all() {
        return List.copyOf(entries);
    }
}
