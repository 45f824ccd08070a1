package com.whitehall.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Resolves command line source arguments to {@code .wh} files.
 */
final class SourceFiles {

    static final String EXTENSION = ".wh";

    private SourceFiles() {
        // Utility class - no instantiation
    }

    /**
     * Expands a file or directory argument.
     *
     * @param source a {@code .wh} file or a directory searched recursively
     * @return source files in path order
     * @throws IOException if the directory cannot be walked
     * @throws IllegalArgumentException if the path does not exist
     */
    static List<Path> collect(Path source) throws IOException {
        if (!Files.exists(source)) {
            throw new IllegalArgumentException("Source not found: " + source);
        }
        if (Files.isRegularFile(source)) {
            return List.of(source);
        }
        try (Stream<Path> paths = Files.walk(source)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                .sorted()
                .toList();
        }
    }
}
