package com.whitehall.core.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes collected native signatures as {@code ffi-manifest.json} for the bridge generator.
 *
 * <p>Functions are grouped by language tag:
 * <pre>{@code
 * {
 *   "rust" : [ { "name" : "add", "parameters" : [ ... ], "returnType" : "Int", ... } ]
 * }
 * }</pre>
 */
public final class ManifestWriter {

    public static final String FILE_NAME = "ffi-manifest.json";

    private static final Logger log = LoggerFactory.getLogger(ManifestWriter.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ManifestWriter() {
        // Utility class - no instantiation
    }

    /**
     * Writes the manifest into a directory.
     *
     * @param directory output directory, created when missing
     * @param functions collected functions
     * @return path of the written manifest
     * @throws IllegalStateException if the manifest cannot be written
     */
    public static Path write(Path directory, List<NativeFunction> functions) {
        Path manifest = directory.resolve(FILE_NAME);
        try {
            Files.createDirectories(directory);
            JSON_MAPPER.writeValue(manifest.toFile(), byLanguage(functions));
            log.info("Wrote {} native signature(s) to {}", functions.size(), manifest);
            return manifest;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write native manifest: " + manifest, e);
        }
    }

    static Map<String, List<NativeFunction>> byLanguage(List<NativeFunction> functions) {
        Map<String, List<NativeFunction>> grouped = new TreeMap<>();
        for (NativeFunction function : functions) {
            grouped.computeIfAbsent(function.sourceLanguage(), k -> new ArrayList<>()).add(function);
        }
        return grouped;
    }
}
