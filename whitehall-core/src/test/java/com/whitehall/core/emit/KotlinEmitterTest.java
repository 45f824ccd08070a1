package com.whitehall.core.emit;

import com.whitehall.core.ast.SourceFile;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.ir.LoweredFile;
import com.whitehall.core.lowering.FileLowering;
import com.whitehall.core.parser.WhitehallParser;
import com.whitehall.core.registry.ComponentRegistry;
import com.whitehall.core.renderer.GeneratedFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KotlinEmitter}.
 */
class KotlinEmitterTest {

    private final KotlinEmitter emitter = new KotlinEmitter(ComponentRegistry.defaults());

    private List<GeneratedFile> emit(String source, String fileName) {
        SourceFile file = new WhitehallParser().parse(source, fileName);
        LoweredFile lowered = new FileLowering(ComponentRegistry.defaults(), "com.example.app", true)
            .lower(file, new Diagnostics());
        return emitter.emit(lowered, fileName);
    }

    @Test
    void emit_counterComponent_writesComposableWithImports() {
        // Given
        String source = """
            var count = 0

            <Column padding={16}>
              <Text>Count: {count}</Text>
              <Button onClick={() => count++}>
                <Text>Increment</Text>
              </Button>
            </Column>
            """;

        // When
        List<GeneratedFile> files = emit(source, "counter.wh");

        // Then
        assertThat(files).singleElement().satisfies(file -> {
            assertThat(file.relativePath()).isEqualTo("com/example/app/Counter.kt");
            assertThat(file.sourceFile()).isEqualTo("counter.wh");
            assertThat(file.content())
                .startsWith("package com.example.app\n")
                .contains("import androidx.compose.runtime.Composable")
                .contains("import androidx.compose.runtime.getValue")
                .contains("import androidx.compose.runtime.setValue")
                .contains("import androidx.compose.foundation.layout.padding")
                .contains("import androidx.compose.ui.unit.dp")
                .contains("@Composable\nfun Counter() {")
                .contains("var count by remember { mutableStateOf(0) }")
                .contains("Column(modifier = Modifier.padding(16.dp)) {")
                .contains("Text(text = \"Count: ${count}\")")
                .contains("Button(onClick = { count++ }) {");
        });
    }

    @Test
    void emit_importsAreSortedAndUnique() {
        // Given
        String source = """
            <Column>
              <Text>One</Text>
              <Text>Two</Text>
            </Column>
            """;

        // When
        String content = emit(source, "list.wh").get(0).content();

        // Then
        List<String> imports = content.lines().filter(line -> line.startsWith("import ")).toList();
        assertThat(imports).isSorted().doesNotHaveDuplicates()
            .contains("import androidx.compose.material3.Text");
    }

    @Test
    void emit_helperComposables_eachGetsComposableAnnotation() {
        // Given
        String source = """
            fun Greeting(name: String) {
              <Text>Hello, {name}</Text>
            }

            <Column>
              <Greeting name="World" />
            </Column>
            """;

        // When
        String content = emit(source, "greeting-screen.wh").get(0).content();

        // Then
        assertThat(content.split("@Composable\n", -1)).hasSize(3);
        assertThat(content)
            .contains("fun GreetingScreen() {")
            .contains("fun Greeting(name: String) {")
            .doesNotContain("import com.example.app.Greeting");
    }

    @Test
    void emit_storeOnlyFile_writesViewModelWithStateFlow() {
        // Given
        String source = """
            @store
            class CounterStore {
              var count = 0
            }
            """;

        // When
        List<GeneratedFile> files = emit(source, "counter-store.wh");

        // Then
        assertThat(files).singleElement().satisfies(file -> {
            assertThat(file.relativePath()).isEqualTo("com/example/app/CounterStore.kt");
            assertThat(file.content())
                .contains("import androidx.lifecycle.ViewModel")
                .contains("import kotlinx.coroutines.flow.MutableStateFlow")
                .contains("import kotlinx.coroutines.flow.update")
                .contains("class CounterStore : ViewModel() {")
                .contains("data class UiState(")
                .contains("val count: Int = 0")
                .contains("private val _uiState = MutableStateFlow(UiState())")
                .contains("val uiState: StateFlow<UiState> = _uiState.asStateFlow()")
                .contains("get() = _uiState.value.count")
                .contains("fun updateCount(value: Int) {")
                .contains("_uiState.update { it.copy(count = value) }");
        });
    }

    @Test
    void emit_objectStore_usesStateFlowNamesWithoutViewModel() {
        // Given
        String source = """
            @store
            object Settings {
              var darkMode = false
            }
            """;

        // When
        String content = emit(source, "settings.wh").get(0).content();

        // Then
        assertThat(content)
            .contains("object Settings {")
            .contains("data class State(")
            .contains("private val _state = MutableStateFlow(State())")
            .doesNotContain("ViewModel");
    }
}
