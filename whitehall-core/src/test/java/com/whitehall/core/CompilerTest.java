package com.whitehall.core;

import com.whitehall.core.config.CompilerConfig;
import com.whitehall.core.diagnostic.Diagnostic;
import com.whitehall.core.diagnostic.DiagnosticKind;
import com.whitehall.core.renderer.GeneratedFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link Compiler}.
 */
class CompilerTest {

    private static final String COUNTER = """
        var count = 0

        <Column padding={16}>
          <Text>Count: {count}</Text>
          <Button onClick={() => count++}>
            <Text>Increment</Text>
          </Button>
        </Column>
        """;

    private final Compiler compiler = new Compiler(CompilerConfig.defaults());

    @Test
    void compile_counter_producesComposableFile() {
        // When
        CompilationResult result = compiler.compile(COUNTER, "counter.wh");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.files()).singleElement().satisfies(file -> {
            assertThat(file.relativePath()).isEqualTo("com/example/app/Counter.kt");
            assertThat(file.content())
                .contains("@Composable")
                .contains("fun Counter() {")
                .contains("var count by remember { mutableStateOf(0) }")
                .contains("Column(modifier = Modifier.padding(16.dp)) {")
                .contains("Text(text = \"Count: ${count}\")")
                .contains("Button(onClick = { count++ }) {")
                .contains("Text(text = \"Increment\")");
        });
    }

    @Test
    void compile_counter_importsEverySymbolItUses() {
        // When
        String content = compiler.compile(COUNTER, "counter.wh").files().get(0).content();

        // Then
        List<String> imports = content.lines()
            .filter(line -> line.startsWith("import "))
            .map(line -> line.substring("import ".length()))
            .toList();
        assertThat(imports).containsExactlyInAnyOrder(
            "androidx.compose.runtime.Composable",
            "androidx.compose.runtime.remember",
            "androidx.compose.runtime.mutableStateOf",
            "androidx.compose.runtime.getValue",
            "androidx.compose.runtime.setValue",
            "androidx.compose.foundation.layout.Column",
            "androidx.compose.foundation.layout.padding",
            "androidx.compose.ui.Modifier",
            "androidx.compose.ui.unit.dp",
            "androidx.compose.material3.Text",
            "androidx.compose.material3.Button");
    }

    @Test
    void compile_sameInputTwice_isDeterministic() {
        // When
        String first = compiler.compile(COUNTER, "counter.wh").files().get(0).content();
        String second = compiler.compile(COUNTER, "counter.wh").files().get(0).content();

        // Then
        assertThat(first).isEqualTo(second);
    }

    @Test
    void compile_syntaxError_reportsPositionAndWritesNothing() {
        // Given
        String source = "<Column>\n  <Text>Hi</Row>\n</Column>";

        // When
        CompilationResult result = compiler.compile(source, "broken.wh");

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.files()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(DiagnosticKind.SYNTAX_ERROR);
            assertThat(error.file()).isEqualTo("broken.wh");
            assertThat(error.line()).isEqualTo(2);
            assertThat(error.column()).isEqualTo(11);
        });
    }

    @Test
    void compile_unknownComponentStrict_failsWithoutOutput() {
        // Given
        String source = "<Sparkles count={3} />";

        // When
        CompilationResult result = compiler.compile(source, "fx.wh");

        // Then
        assertThat(result.files()).isEmpty();
        assertThat(result.errors()).extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNRESOLVED_COMPONENT);
    }

    @Test
    void compile_unknownComponentPermissive_warnsAndPassesThrough() {
        // Given
        Compiler permissive = new Compiler(CompilerConfig.defaults().withStrict(false));

        // When
        CompilationResult result = permissive.compile("<Sparkles count={3} />", "fx.wh");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.warnings()).extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNRESOLVED_COMPONENT);
        assertThat(result.files().get(0).content()).contains("Sparkles(count = 3)");
    }

    @Test
    void compile_configuredComponent_isResolvedAndImported() {
        // Given
        CompilerConfig config = new CompilerConfig("com.acme", true, null, List.of(
            new CompilerConfig.ComponentDefinition("Badge", "androidx.compose.material3.Badge", null, List.of())));

        // When
        CompilationResult result = new Compiler(config).compile("<Badge />", "badge.wh");

        // Then
        assertThat(result.isSuccess()).isTrue();
        GeneratedFile file = result.files().get(0);
        assertThat(file.relativePath()).isEqualTo("com/acme/Badge.kt");
        assertThat(file.content()).contains("import androidx.compose.material3.Badge");
    }

    @Test
    void compile_storeFile_writesComposableAndViewModel() {
        // Given
        String source = """
            @store
            class CounterStore {
              var count = 0
            }

            val counter = CounterStore()

            <Button onClick={() => counter.count++} text="Add" />
            """;

        // When
        CompilationResult result = compiler.compile(source, "counter-screen.wh");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.files()).extracting(GeneratedFile::relativePath).containsExactly(
            "com/example/app/CounterScreen.kt",
            "com/example/app/CounterStore.kt");
    }

    @Test
    void compile_nativeSignatures_areCollected() {
        // Given
        String source = """
            @ffi("rust")
            fun add(a: Int, b: Int): Int
            """;

        // When
        CompilationResult result = compiler.compile(source, "math.wh");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.files()).isEmpty();
        assertThat(result.nativeFunctions()).singleElement().satisfies(function -> {
            assertThat(function.name()).isEqualTo("add");
            assertThat(function.sourceLanguage()).isEqualTo("rust");
        });
    }
}
