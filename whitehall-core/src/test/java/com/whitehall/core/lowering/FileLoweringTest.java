package com.whitehall.core.lowering;

import com.whitehall.core.ast.SourceFile;
import com.whitehall.core.diagnostic.DiagnosticKind;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.diagnostic.Severity;
import com.whitehall.core.emit.ExpressionPrinter;
import com.whitehall.core.ir.LoweredComposable;
import com.whitehall.core.ir.LoweredFile;
import com.whitehall.core.ir.UiNode;
import com.whitehall.core.parser.WhitehallParser;
import com.whitehall.core.registry.ComponentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileLowering}.
 */
class FileLoweringTest {

    private final WhitehallParser parser = new WhitehallParser();
    private final ExpressionPrinter printer = new ExpressionPrinter();
    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
    }

    private LoweredFile lower(String source, String fileName, boolean strict) {
        SourceFile file = parser.parse(source, fileName);
        return new FileLowering(ComponentRegistry.defaults(), "com.example.app", strict).lower(file, diagnostics);
    }

    private String body(LoweredComposable composable) {
        return printer.printNodes(composable.body());
    }

    @Test
    void lower_forInsideLazyColumn_usesItemsBuilder() {
        // Given
        String source = """
            <LazyColumn>
              @for (todo in getFiltered(), key = { it.id }) {
                <Text>{todo.title}</Text>
              }
            </LazyColumn>
            """;

        // When
        LoweredFile lowered = lower(source, "todos.wh", true);

        // Then
        UiNode.ComponentCall list = (UiNode.ComponentCall) lowered.composables().get(0).body().get(0);
        assertThat(list.content().children()).singleElement().isInstanceOf(UiNode.LazyItems.class);
        String kotlin = body(lowered.composables().get(0));
        assertThat(kotlin)
            .contains("items(getFiltered(), key = { it.id }) { todo ->")
            .contains("Text(text = \"${todo.title}\")")
            .doesNotContain("forEach")
            .doesNotContain("Adapter");
    }

    @Test
    void lower_forInsideColumn_repeatsInlineWithKey() {
        // Given
        String source = """
            val todos = listOf("a", "b")

            <Column>
              @for (todo in todos, key = { it.length }) {
                <Text>{todo}</Text>
              }
            </Column>
            """;

        // When
        LoweredFile lowered = lower(source, "todos.wh", true);

        // Then
        String kotlin = body(lowered.composables().get(0));
        assertThat(kotlin)
            .contains("todos.forEach { todo ->")
            .contains("key(todo.length) {")
            .doesNotContain("items(");
    }

    @Test
    void lower_plainChildrenOfLazyColumn_becomeItems() {
        // Given
        String source = """
            <LazyColumn>
              <Text>Header</Text>
            </LazyColumn>
            """;

        // When
        LoweredFile lowered = lower(source, "list.wh", true);

        // Then
        UiNode.ComponentCall list = (UiNode.ComponentCall) lowered.composables().get(0).body().get(0);
        assertThat(list.content().children()).singleElement().isInstanceOf(UiNode.LazyItem.class);
    }

    @Test
    void lower_forWithEmptyBlock_guardsLoopWithIsEmpty() {
        // Given
        String source = """
            val names = listOf("a")

            <Column>
              @for (name in names) {
                <Text>{name}</Text>
              } empty {
                <Text>No names</Text>
              }
            </Column>
            """;

        // When
        String kotlin = body(lower(source, "names.wh", true).composables().get(0));

        // Then
        assertThat(kotlin).contains("if (names.isEmpty()) {").contains("Text(text = \"No names\")")
            .contains("names.forEach { name ->");
    }

    @Test
    void lower_mutableState_isRememberedWithDelegate() {
        // Given
        String source = """
            var count = 0
            val label = "Count"

            <Text>{label}: {count}</Text>
            """;

        // When
        String kotlin = body(lower(source, "counter.wh", true).composables().get(0));

        // Then
        assertThat(kotlin)
            .contains("var count by remember { mutableStateOf(0) }")
            .contains("val label = \"Count\"")
            .contains("Text(text = \"${label}: ${count}\")");
    }

    @Test
    void lower_storeBinding_collectsStateAndRoutesWrites() {
        // Given
        String source = """
            @store
            class CounterStore {
              var count = 0
            }

            val counter = CounterStore()

            <Column>
              <Text>{counter.count}</Text>
              <Button onClick={() => counter.count++} text="Add" />
            </Column>
            """;

        // When
        LoweredFile lowered = lower(source, "counter-screen.wh", true);

        // Then
        String kotlin = body(lowered.composables().get(0));
        assertThat(kotlin)
            .contains("val counterState by counter.uiState.collectAsState()")
            .contains("val counter = viewModel<CounterStore>()")
            .contains("Text(text = \"${counterState.count}\")")
            .contains("counter.updateCount(counter.count + 1)")
            .containsSubsequence("val counter = viewModel<CounterStore>()",
                "val counterState by counter.uiState.collectAsState()");
        assertThat(lowered.stores()).singleElement().satisfies(s -> assertThat(s.name()).isEqualTo("CounterStore"));
    }

    @Test
    void lower_directiveAmongTopLevelRoots_repeatsInsideColumn() {
        // Given
        String source = """
            val xs = listOf(1, 2)

            <Text>head</Text>
            @for (x in xs) {
              <Text>{x}</Text>
            }
            """;

        // When
        LoweredFile lowered = lower(source, "rows.wh", true);

        // Then
        assertThat(diagnostics.hasErrors()).isFalse();
        UiNode.ComponentCall column = (UiNode.ComponentCall) lowered.composables().get(0).body().stream()
            .filter(UiNode.ComponentCall.class::isInstance)
            .findFirst()
            .orElseThrow();
        assertThat(column.name()).isEqualTo("Column");
        assertThat(body(lowered.composables().get(0)))
            .containsSubsequence("Text(text = \"head\")", "xs.forEach { x ->")
            .doesNotContain("items(");
    }

    @Test
    void lower_directivesInHelperBody_areEmittedInSequence() {
        // Given
        String source = """
            fun Rows(xs: List<Int>) {
              <Text>head</Text>
              @if (xs.isEmpty()) {
                <Text>none</Text>
              }
              @for (x in xs) {
                <Text>{x}</Text>
              }
            }

            <Rows xs={listOf(1, 2)} />
            """;

        // When
        LoweredFile lowered = lower(source, "rows-screen.wh", true);

        // Then
        LoweredComposable rows = lowered.composables().get(1);
        assertThat(rows.name()).isEqualTo("Rows");
        assertThat(rows.body()).hasSize(3);
        assertThat(rows.body().get(1)).isInstanceOf(UiNode.IfChain.class);
        assertThat(rows.body().get(2)).isInstanceOf(UiNode.InlineRepeat.class);
        assertThat(body(rows))
            .containsSubsequence("Text(text = \"head\")", "if (xs.isEmpty()) {", "xs.forEach { x ->");
    }

    @Test
    void lower_helperComposables_areLoweredAfterMain() {
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
        LoweredFile lowered = lower(source, "greeting-screen.wh", true);

        // Then
        assertThat(lowered.composables()).extracting(LoweredComposable::name)
            .containsExactly("GreetingScreen", "Greeting");
        assertThat(body(lowered.composables().get(0))).contains("Greeting(name = \"World\")");
        assertThat(lowered.mainFileName()).isEqualTo("GreetingScreen");
        assertThat(lowered.packageName()).isEqualTo("com.example.app");
    }

    @Test
    void lower_unknownComponentInStrictMode_reportsError() {
        // Given
        String source = "<Column><Sparkles /></Column>";

        // When
        lower(source, "bad.wh", true);

        // Then
        assertThat(diagnostics.all()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNRESOLVED_COMPONENT);
            assertThat(d.severity()).isEqualTo(Severity.ERROR);
            assertThat(d.componentName()).isEqualTo("Sparkles");
        });
    }

    @Test
    void lower_unknownComponentInPermissiveMode_isCalledAnyway() {
        // Given
        String source = "<Column><Sparkles count={3} /></Column>";

        // When
        LoweredFile lowered = lower(source, "bad.wh", false);

        // Then
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(body(lowered.composables().get(0))).contains("Sparkles(count = 3)");
    }

    @Test
    void lower_scaffold_passesPaddingToContent() {
        // Given
        String source = """
            <Scaffold topBar={<TopAppBar title="Home" />}>
              <Text>Body</Text>
            </Scaffold>
            """;

        // When
        String kotlin = body(lower(source, "home.wh", true).composables().get(0));

        // Then
        assertThat(kotlin).contains("paddingValues ->").contains("Box(modifier = Modifier.padding(paddingValues))");
    }

    @Test
    void lower_storeNamedLikeFile_movesComposablesToOwnFile() {
        // Given
        String source = """
            @store
            class Counter {
              var count = 0
            }

            <Text>Hi</Text>
            """;

        // When
        LoweredFile lowered = lower(source, "counter.wh", true);

        // Then
        assertThat(lowered.mainFileName()).isEqualTo("CounterComponents");
    }
}
