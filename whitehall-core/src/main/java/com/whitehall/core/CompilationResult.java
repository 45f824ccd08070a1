package com.whitehall.core;

import com.whitehall.core.bridge.NativeFunction;
import com.whitehall.core.diagnostic.Diagnostic;
import com.whitehall.core.renderer.GeneratedFile;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of compiling one source file.
 *
 * <p>When any diagnostic is an error, {@code files} is empty: a partially lowered file is never
 * produced.
 *
 * @param fileName source file name
 * @param files generated files, main file first
 * @param diagnostics errors and warnings in the order they were found
 * @param nativeFunctions {@code @ffi} signatures declared in the file
 */
public record CompilationResult(
    String fileName,
    List<GeneratedFile> files,
    List<Diagnostic> diagnostics,
    List<NativeFunction> nativeFunctions
) {

    public CompilationResult {
        Objects.requireNonNull(fileName, "fileName must not be null");
        files = files != null ? List.copyOf(files) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        nativeFunctions = nativeFunctions != null ? List.copyOf(nativeFunctions) : List.of();
    }

    public boolean isSuccess() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }
}
