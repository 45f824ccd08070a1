package com.whitehall.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest {

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

    private int execute(String... args) {
        return new CommandLine(new CheckCommand()).execute(args);
    }

    private String missingConfig() {
        return tempDir.resolve("absent.yaml").toString();
    }

    @Test
    void check_validFile_returnsZeroAndWritesNothing() throws IOException {
        // Given
        Path source = tempDir.resolve("hello.wh");
        Files.writeString(source, "<Text>Hello</Text>");

        // When
        int exitCode = execute(source.toString(), "-c", missingConfig());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("1 file(s) checked, 0 warning(s)");
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(source);
        }
    }

    @Test
    void check_syntaxError_printsLocationAndReturnsOne() throws IOException {
        // Given
        Path source = tempDir.resolve("broken.wh");
        Files.writeString(source, "<Column>\n  <Text>Hi</Row>\n</Column>");

        // When
        int exitCode = execute(source.toString(), "-c", missingConfig());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("broken.wh:2:11:")
            .contains("1 error(s)");
    }

    @Test
    void check_json_printsDiagnosticsArray() throws IOException {
        // Given
        Path source = tempDir.resolve("fx.wh");
        Files.writeString(source, "<Sparkles />");

        // When
        int exitCode = execute(source.toString(), "-c", missingConfig(), "--json");

        // Then
        assertThat(exitCode).isEqualTo(1);
        JsonNode diagnostics = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertThat(diagnostics.isArray()).isTrue();
        assertThat(diagnostics).hasSize(1);
        JsonNode first = diagnostics.get(0);
        assertThat(first.get("severity").asText()).isEqualTo("ERROR");
        assertThat(first.get("kind").asText()).isEqualTo("UNRESOLVED_COMPONENT");
        assertThat(first.get("file").asText()).isEqualTo("fx.wh");
        assertThat(first.get("componentName").asText()).isEqualTo("Sparkles");
    }

    @Test
    void check_permissive_reportsWarningAndSucceeds() throws IOException {
        // Given
        Path source = tempDir.resolve("fx.wh");
        Files.writeString(source, "<Sparkles />");

        // When
        int exitCode = execute(source.toString(), "-c", missingConfig(), "--permissive");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("1 warning(s)");
    }
}
