package com.whitehall.core.renderer;

import java.util.Objects;

/**
 * A generated Kotlin file.
 *
 * @param relativePath path below the output directory, mirroring the package (e.g. "com/example/app/Counter.kt")
 * @param content file content
 * @param sourceFile the {@code .wh} file it was generated from
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String sourceFile
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
