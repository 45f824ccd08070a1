package com.whitehall.core.renderer.impl;

import com.whitehall.core.renderer.GeneratedFile;
import com.whitehall.core.renderer.GeneratedOutput;
import com.whitehall.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withPackagePath_createsPackageDirectories() throws IOException {
        // Given
        String content = "package com.example.app\n\nfun Counter() {}\n";
        GeneratedFile file = new GeneratedFile("com/example/app/Counter.kt", content, "counter.wh");
        RenderContext context = new RenderContext(tempDir.toString(), Map.of());

        // When
        renderer.render(new GeneratedOutput(List.of(file)), context);

        // Then
        Path expectedFile = tempDir.resolve("com/example/app/Counter.kt");
        assertThat(expectedFile).exists();
        assertThat(Files.readString(expectedFile)).isEqualTo(content);
    }

    @Test
    void render_withMultipleFiles_writesAll() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("com/example/app/Counter.kt", "a", "counter.wh"),
            new GeneratedFile("com/example/app/CounterStore.kt", "b", "counter.wh")));
        RenderContext context = new RenderContext(tempDir.toString(), Map.of());

        // When
        renderer.render(output, context);

        // Then
        assertThat(tempDir.resolve("com/example/app/Counter.kt")).hasContent("a");
        assertThat(tempDir.resolve("com/example/app/CounterStore.kt")).hasContent("b");
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        // Given
        Path target = tempDir.resolve("App.kt");
        Files.writeString(target, "old");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("App.kt", "new", "app.wh")));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(target).hasContent("new");
    }

    @Test
    void render_missingOutputDirectory_isCreated() {
        // Given
        Path outputDir = tempDir.resolve("build/generated/whitehall");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("App.kt", "x", "app.wh")));

        // When
        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(outputDir.resolve("App.kt")).exists();
    }

    @Test
    void render_outputDirectoryIsAFile_throwsIllegalState() throws IOException {
        // Given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("App.kt", "x", "app.wh")));

        // When / Then
        assertThatThrownBy(() -> renderer.render(output, new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }
}
