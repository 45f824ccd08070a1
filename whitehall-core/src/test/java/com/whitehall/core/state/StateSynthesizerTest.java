package com.whitehall.core.state;

import com.whitehall.core.ast.StoreClass;
import com.whitehall.core.diagnostic.DiagnosticKind;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.diagnostic.TypeInferenceError;
import com.whitehall.core.emit.ExpressionPrinter;
import com.whitehall.core.ir.StoreModel;
import com.whitehall.core.parser.WhitehallParser;
import com.whitehall.core.transform.ExpressionTransformer;
import com.whitehall.core.transform.RawCodeRewriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link StateSynthesizer}.
 */
class StateSynthesizerTest {

    private Diagnostics diagnostics;
    private StateSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        ExpressionTransformer transformer = new ExpressionTransformer();
        synthesizer = new StateSynthesizer(transformer,
            new RawCodeRewriter(transformer, new ExpressionPrinter()), diagnostics);
    }

    private static StoreClass store(String source) {
        return new WhitehallParser().parse(source, "store.wh").stores().get(0);
    }

    @Test
    void synthesize_writableFields_getStateFieldsAndUpdateMethods() {
        // Given
        StoreClass store = store("""
            @store
            class CounterStore {
              var count = 0
              var labels = listOf("a", "b")
              val title = "Counter"
            }
            """);

        // When
        StoreModel model = synthesizer.synthesize(store, "store.wh");

        // Then
        assertThat(model.stateClassName()).isEqualTo("UiState");
        assertThat(model.backingFlow()).isEqualTo("_uiState");
        assertThat(model.fields()).extracting(StoreModel.StateField::name, StoreModel.StateField::type)
            .containsExactly(
                tuple("count", "Int"),
                tuple("labels", "List<String>"),
                tuple("title", "String"));
        assertThat(model.updates()).extracting(StoreModel.UpdateMethod::name)
            .containsExactly("updateCount", "updateLabels");
        assertThat(diagnostics.all()).isEmpty();
    }

    @Test
    void synthesize_userDeclaredUpdateMethod_keepsOnlyTheUserOne() {
        // Given
        StoreClass store = store("""
            @store
            class CounterStore {
              var count = 0

              fun updateCount(value: Int) {
                count = value
              }
            }
            """);

        // When
        StoreModel model = synthesizer.synthesize(store, "store.wh");

        // Then
        assertThat(model.updates()).isEmpty();
        assertThat(model.methods()).singleElement().satisfies(method -> {
            assertThat(method.signature()).isEqualTo("fun updateCount(value: Int)");
            assertThat(method.body()).contains("_uiState.update { it.copy(count = value) }");
        });
        assertThat(diagnostics.all()).singleElement()
            .satisfies(d -> assertThat(d.kind()).isEqualTo(DiagnosticKind.NAME_CONFLICT));
    }

    @Test
    void synthesize_methodWritingState_routesThroughUpdateMethod() {
        // Given
        StoreClass store = store("""
            @store
            class CounterStore {
              var count = 0

              fun increment() {
                // bump
                count++
              }
            }
            """);

        // When
        StoreModel model = synthesizer.synthesize(store, "store.wh");

        // Then
        String body = model.methods().get(0).body();
        assertThat(body).contains("// bump").contains("updateCount(count + 1)").doesNotContain("count++");
    }

    @Test
    void synthesize_computedAndPrivateMembers_stayOutOfState() {
        // Given
        StoreClass store = store("""
            @store
            class CartStore {
              var prices = listOf(1, 2)
              val total: Int get() = prices.sum()
              private var requests = 0
            }
            """);

        // When
        StoreModel model = synthesizer.synthesize(store, "store.wh");

        // Then
        assertThat(model.fields()).extracting(StoreModel.StateField::name).containsExactly("prices");
        assertThat(model.computed()).extracting(StoreModel.ComputedProperty::name).containsExactly("total");
        assertThat(model.privateFields()).extracting(StoreModel.PrivateField::name).containsExactly("requests");
        assertThat(model.updates()).extracting(StoreModel.UpdateMethod::name).containsExactly("updatePrices");
    }

    @Test
    void synthesize_suspendMethodOfViewModel_isLaunched() {
        // Given
        StoreClass store = store("""
            @store
            class UserStore {
              var name = ""

              suspend fun load() {
                name = "Ann"
              }
            }
            """);

        // When
        StoreModel model = synthesizer.synthesize(store, "store.wh");

        // Then
        StoreModel.StoreMethod load = model.methods().get(0);
        assertThat(load.signature()).isEqualTo("fun load()");
        assertThat(load.launched()).isTrue();
        assertThat(load.body()).contains("updateName(\"Ann\")");
    }

    @Test
    void synthesize_objectStoreWithDispatch_ownsCoroutineScope() {
        // Given
        StoreClass store = store("""
            @store
            object Settings {
              var dark = false

              fun refresh() {
                io {
                  dark = true
                }
              }
            }
            """);

        // When
        StoreModel model = synthesizer.synthesize(store, "store.wh");

        // Then
        assertThat(model.singleton()).isTrue();
        assertThat(model.stateClassName()).isEqualTo("State");
        assertThat(model.ownScope()).isTrue();
        assertThat(model.methods().get(0).body()).contains("scope.launch(Dispatchers.IO)");
    }

    @Test
    void synthesize_untypedEmptyCollection_throwsTypeInferenceError() {
        // Given
        StoreClass store = store("""
            @store
            class TodoStore {
              var todos = emptyList()
            }
            """);

        // When / Then
        assertThatThrownBy(() -> synthesizer.synthesize(store, "store.wh"))
            .isInstanceOf(TypeInferenceError.class)
            .hasMessageContaining("Cannot infer the type of 'todos'");
    }
}
