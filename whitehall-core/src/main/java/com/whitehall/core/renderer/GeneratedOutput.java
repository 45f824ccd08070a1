package com.whitehall.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Files generated by one compiler run.
 *
 * @param files generated files in emission order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
