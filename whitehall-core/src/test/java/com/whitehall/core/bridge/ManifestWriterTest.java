package com.whitehall.core.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ManifestWriter}.
 */
class ManifestWriterTest {

    @TempDir
    Path tempDir;

    private static NativeFunction function(String name, String language) {
        return new NativeFunction(name, List.of(new NativeParameter("a", "Int")), "Int", language, "math.wh");
    }

    @Test
    void write_functions_groupsThemByLanguage() throws IOException {
        // Given
        List<NativeFunction> functions = List.of(
            function("add", "rust"),
            function("blur", "cpp"),
            function("mul", "rust"));

        // When
        Path manifest = ManifestWriter.write(tempDir.resolve("out"), functions);

        // Then
        assertThat(manifest).isEqualTo(tempDir.resolve("out").resolve(ManifestWriter.FILE_NAME));
        JsonNode root = new ObjectMapper().readTree(Files.readString(manifest));
        assertThat(root.fieldNames()).toIterable().containsExactly("cpp", "rust");
        assertThat(root.get("rust")).hasSize(2);
        JsonNode add = root.get("rust").get(0);
        assertThat(add.get("name").asText()).isEqualTo("add");
        assertThat(add.get("returnType").asText()).isEqualTo("Int");
        assertThat(add.get("sourceFile").asText()).isEqualTo("math.wh");
        assertThat(add.get("parameters").get(0).get("type").asText()).isEqualTo("Int");
    }

    @Test
    void byLanguage_keepsDeclarationOrderWithinLanguage() {
        // When
        Map<String, List<NativeFunction>> grouped = ManifestWriter.byLanguage(List.of(
            function("b", "rust"), function("a", "rust")));

        // Then
        assertThat(grouped.get("rust")).extracting(NativeFunction::name).containsExactly("b", "a");
    }
}
