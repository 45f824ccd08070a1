package com.whitehall.core.bridge;

import java.util.List;
import java.util.Objects;

/**
 * Body-less function annotated {@code @ffi("lang")}, handed to the native-bridge generator.
 *
 * @param name function name
 * @param parameters declared parameters
 * @param returnType declared return type, {@code Unit} when omitted
 * @param sourceLanguage language tag from the annotation, such as {@code rust} or {@code cpp}
 * @param sourceFile file the signature was declared in
 */
public record NativeFunction(
    String name,
    List<NativeParameter> parameters,
    String returnType,
    String sourceLanguage,
    String sourceFile
) {

    public NativeFunction {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        returnType = returnType != null ? returnType : "Unit";
    }
}
