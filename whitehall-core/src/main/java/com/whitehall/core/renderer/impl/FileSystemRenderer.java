package com.whitehall.core.renderer.impl;

import com.whitehall.core.renderer.GeneratedFile;
import com.whitehall.core.renderer.GeneratedOutput;
import com.whitehall.core.renderer.OutputRenderer;
import com.whitehall.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes generated Kotlin files below the output directory.
 *
 * <p>Package directories are created as needed and existing files are overwritten.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("com/example/app/Counter.kt", "package com.example.app\n...", "counter.wh")
 * ));
 *
 * new FileSystemRenderer().render(output, new RenderContext("build/generated", Map.of()));
 * // Creates: build/generated/com/example/app/Counter.kt
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Writing {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.info("Wrote {} ({} bytes)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
