package com.whitehall.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void list_components_printsBuiltInRegistry() {
        // When
        int exitCode = new CommandLine(new ListCommand())
            .execute("components", "-c", tempDir.resolve("absent.yaml").toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .startsWith("Available Components:")
            .contains("  • Text (androidx.compose.material3.Text)")
            .contains("  • LazyColumn (androidx.compose.foundation.lazy.LazyColumn)");
    }

    @Test
    void list_components_includesConfiguredRows() throws IOException {
        // Given
        Path config = tempDir.resolve("whitehall.yaml");
        Files.writeString(config, """
            components:
              - name: Badge
                import: androidx.compose.material3.Badge
            """);

        // When
        int exitCode = new CommandLine(new ListCommand()).execute("components", "-c", config.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("  • Badge (androidx.compose.material3.Badge)");
    }

    @Test
    void list_unknownType_returnsOne() {
        // When
        int exitCode = new CommandLine(new ListCommand())
            .execute("scanners", "-c", tempDir.resolve("absent.yaml").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
    }
}
