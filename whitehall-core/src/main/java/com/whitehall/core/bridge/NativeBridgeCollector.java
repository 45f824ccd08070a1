package com.whitehall.core.bridge;

import com.whitehall.core.ast.Annotation;
import com.whitehall.core.ast.FunctionDeclaration;
import com.whitehall.core.ast.SourceFile;
import com.whitehall.core.diagnostic.SyntaxError;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects native function signatures from a parsed file.
 */
public final class NativeBridgeCollector {

    private static final String ANNOTATION = "ffi";

    private NativeBridgeCollector() {
        // Utility class - no instantiation
    }

    /**
     * Returns the {@code @ffi} signatures of a file in source order.
     *
     * @param file parsed file
     * @return native functions; empty when the file declares none
     * @throws SyntaxError if a signature lacks a language tag or a parameter type
     */
    public static List<NativeFunction> collect(SourceFile file) {
        List<NativeFunction> functions = new ArrayList<>();
        for (FunctionDeclaration function : file.functions()) {
            Annotation ffi = function.annotation(ANNOTATION);
            if (ffi == null) {
                continue;
            }
            String language = ffi.stringArgument();
            if (language == null || language.isBlank()) {
                throw new SyntaxError(file.fileName(), function.position(),
                    "@ffi on '" + function.name() + "' needs a language, e.g. @ffi(\"rust\")");
            }
            if (function.hasBody()) {
                throw new SyntaxError(file.fileName(), function.position(),
                    "Native function '" + function.name() + "' must not have a body");
            }
            List<NativeParameter> parameters = function.parameters().stream()
                .map(p -> {
                    if (p.type() == null) {
                        throw new SyntaxError(file.fileName(), function.position(),
                            "Parameter '" + p.name() + "' of native function '" + function.name() + "' needs a type");
                    }
                    return new NativeParameter(p.name(), p.type());
                })
                .toList();
            functions.add(new NativeFunction(function.name(), parameters, function.returnType(), language,
                file.fileName()));
        }
        return functions;
    }
}
