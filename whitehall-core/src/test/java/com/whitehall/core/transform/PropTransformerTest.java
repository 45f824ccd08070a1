package com.whitehall.core.transform;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.Lambda;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.MarkupNode;
import com.whitehall.core.ast.PropValue;
import com.whitehall.core.ast.SourcePosition;
import com.whitehall.core.ast.StateScope;
import com.whitehall.core.ast.StateVar;
import com.whitehall.core.diagnostic.Diagnostic;
import com.whitehall.core.diagnostic.DiagnosticKind;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.diagnostic.Severity;
import com.whitehall.core.emit.ExpressionPrinter;
import com.whitehall.core.ir.ContentLambda;
import com.whitehall.core.ir.UiNode;
import com.whitehall.core.registry.ComponentRegistry;
import com.whitehall.core.registry.ComponentSpec;
import com.whitehall.core.registry.PropKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PropTransformer}.
 */
class PropTransformerTest {

    private static final SourcePosition POS = new SourcePosition(4, 3);
    private static final SlotLowering SLOTS = node -> List.of(new UiNode.ComponentCall(node.tag(), List.of(), null));

    private final ComponentRegistry registry = ComponentRegistry.defaults();
    private final ExpressionPrinter printer = new ExpressionPrinter();
    private Diagnostics diagnostics;
    private TransformContext ctx;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        StateVar age = new StateVar("age", null, Literal.number("0"), true, StateScope.LOCAL,
            StateVar.Kind.PLAIN, false, POS);
        StateVar name = new StateVar("name", null, Literal.string(""), true, StateScope.LOCAL,
            StateVar.Kind.PLAIN, false, POS);
        ctx = TransformContext.forComponent("form.wh", "Form",
            new ScopeSymbols(Map.of("age", age, "name", name), Map.of(), null, null));
    }

    private static MarkupNode node(String tag, Object... nameValuePairs) {
        Map<String, PropValue> props = new LinkedHashMap<>();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            props.put((String) nameValuePairs[i], (PropValue) nameValuePairs[i + 1]);
        }
        return new MarkupNode(tag, props, List.of(), POS);
    }

    private static PropValue text(String value) {
        return new PropValue.Literal(value);
    }

    private static PropValue expr(ExprNode value) {
        return new PropValue.Expression(value);
    }

    private LoweredProps lower(MarkupNode node, boolean strict) {
        ComponentSpec spec = registry.find(node.tag()).orElseThrow();
        return new PropTransformer(new ExpressionTransformer(), diagnostics, strict).lower(node, spec, ctx, SLOTS);
    }

    private String printed(LoweredProps props, String argument) {
        return props.arguments().stream()
            .filter(a -> argument.equals(a.name()))
            .map(a -> printer.print(a.value()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No argument " + argument));
    }

    @Test
    void lower_modifierProps_foldIntoOneChainLast() {
        // Given
        MarkupNode column = node("Column",
            "padding", expr(Literal.number("16")),
            "spacing", text("8"),
            "fillMaxWidth", new PropValue.Literal(Boolean.TRUE));

        // When
        LoweredProps props = lower(column, true);

        // Then
        assertThat(props.arguments()).extracting(Argument::name)
            .containsExactly("verticalArrangement", "modifier");
        assertThat(printed(props, "modifier")).isEqualTo("Modifier.padding(16.dp).fillMaxWidth()");
        assertThat(printed(props, "verticalArrangement")).isEqualTo("Arrangement.spacedBy(8.dp)");
        assertThat(diagnostics.all()).isEmpty();
    }

    @Test
    void lower_formattedTextProps_useTargetTypes() {
        // Given
        MarkupNode text = node("Text",
            "fontWeight", text("bold"),
            "color", text("#FF0000"),
            "fontSize", text("18"),
            "style", text("titleLarge"));

        // When
        LoweredProps props = lower(text, true);

        // Then
        assertThat(printed(props, "fontWeight")).isEqualTo("FontWeight.Bold");
        assertThat(printed(props, "color")).isEqualTo("Color(0xFFFF0000)");
        assertThat(printed(props, "fontSize")).isEqualTo("18.sp");
        assertThat(printed(props, "style")).isEqualTo("MaterialTheme.typography.titleLarge");
    }

    @Test
    void lower_conditionalFlag_appliesModifierThroughThen() {
        // Given
        MarkupNode box = node("Box", "fillMaxSize", expr(new Identifier("expanded")));

        // When
        LoweredProps props = lower(box, true);

        // Then
        assertThat(printed(props, "modifier"))
            .isEqualTo("Modifier.then(if (expanded) Modifier.fillMaxSize() else Modifier)");
    }

    @Test
    void lower_buttonTextAndFunctionReference_produceLabelAndCallback() {
        // Given
        MarkupNode button = node("Button",
            "onClick", expr(new Identifier("save")),
            "text", text("Save"));

        // When
        LoweredProps props = lower(button, true);

        // Then
        assertThat(printed(props, "onClick")).isEqualTo("{ save() }");
        assertThat(props.leadingChildren()).hasSize(1);
        UiNode.ComponentCall label = (UiNode.ComponentCall) props.leadingChildren().get(0);
        assertThat(label.name()).isEqualTo("Text");
        assertThat(printer.print(label.arguments().get(0).value())).isEqualTo("\"Save\"");
    }

    @Test
    void lower_numericBinding_parsesIncomingText() {
        // Given
        MarkupNode field = node("TextField", "bind:value", expr(new Identifier("age")));

        // When
        LoweredProps props = lower(field, true);

        // Then
        assertThat(printed(props, "value")).isEqualTo("age.toString()");
        assertThat(printed(props, "onValueChange")).isEqualTo("{ age = it.toIntOrNull() ?: age }");
    }

    @Test
    void lower_stringBinding_assignsIncomingValue() {
        // Given
        MarkupNode field = node("OutlinedTextField", "bind:value", expr(new Identifier("name")));

        // When
        LoweredProps props = lower(field, true);

        // Then
        assertThat(printed(props, "value")).isEqualTo("name");
        assertThat(printed(props, "onValueChange")).isEqualTo("{ name = it }");
    }

    static Stream<Arguments> composableSlots() {
        return ComponentRegistry.defaults().all().stream()
            .flatMap(spec -> spec.props().values().stream()
                .filter(prop -> prop.kind() == PropKind.COMPOSABLE_SLOT)
                .map(prop -> Arguments.of(spec.name(), prop.name(), prop.target())));
    }

    @ParameterizedTest(name = "{0}.{1}")
    @MethodSource("composableSlots")
    void lower_markupInAnySlot_becomesZeroArgumentContentLambda(String component, String prop, String target) {
        // Given
        MarkupNode node = node(component, prop, new PropValue.Markup(new MarkupNode("IconButton", Map.of(), List.of(), POS)));

        // When
        LoweredProps props = lower(node, true);

        // Then
        assertThat(diagnostics.all()).isEmpty();
        Argument argument = props.arguments().stream()
            .filter(a -> target.equals(a.name()))
            .findFirst()
            .orElseThrow();
        assertThat(argument.value()).isInstanceOfSatisfying(ContentLambda.class, lambda -> {
            assertThat(lambda.parameters()).isEmpty();
            assertThat(lambda.body()).singleElement()
                .isInstanceOfSatisfying(UiNode.ComponentCall.class, call ->
                    assertThat(call.name()).isEqualTo("IconButton"));
        });
    }

    @Test
    void lower_slotWithText_wrapsInContentLambda() {
        // Given
        MarkupNode bar = node("TopAppBar",
            "title", text("Home"),
            "navigationIcon", new PropValue.Markup(new MarkupNode("IconButton", Map.of(), List.of(), POS)));

        // When
        LoweredProps props = lower(bar, true);

        // Then
        assertThat(props.arguments()).extracting(Argument::name).containsExactly("title", "navigationIcon");
        assertThat(props.arguments()).allSatisfy(a -> assertThat(a.value()).isInstanceOf(ContentLambda.class));
        ContentLambda icon = (ContentLambda) props.arguments().get(1).value();
        assertThat(((UiNode.ComponentCall) icon.body().get(0)).name()).isEqualTo("IconButton");
    }

    @Test
    void lower_slotWithPlainExpression_wrapsInTextContentLambda() {
        // Given
        MarkupNode bar = node("TopAppBar", "title", expr(new Identifier("t")));

        // When
        LoweredProps props = lower(bar, true);

        // Then
        assertThat(props.arguments()).singleElement()
            .satisfies(a -> assertThat(a.value()).isInstanceOf(ContentLambda.class));
        ContentLambda title = (ContentLambda) props.arguments().get(0).value();
        assertThat(title.parameters()).isEmpty();
        UiNode.ComponentCall text = (UiNode.ComponentCall) title.body().get(0);
        assertThat(text.name()).isEqualTo("Text");
        assertThat(text.arguments()).singleElement()
            .isEqualTo(new Argument("text", new Identifier("t")));
    }

    @Test
    void lower_unknownPropInStrictMode_reportsErrorAndDropsIt() {
        // Given
        MarkupNode text = node("Text", "text", text("Hi"), "sparkle", text("yes"));

        // When
        LoweredProps props = lower(text, true);

        // Then
        assertThat(props.arguments()).extracting(Argument::name).containsExactly("text");
        assertThat(diagnostics.all()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.ERROR);
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNSUPPORTED_PROP);
            assertThat(d.componentName()).isEqualTo("Text");
            assertThat(d.propName()).isEqualTo("sparkle");
            assertThat(d.line()).isEqualTo(4);
        });
    }

    @Test
    void lower_unknownPropInPermissiveMode_passesThroughWithWarning() {
        // Given
        MarkupNode text = node("Text", "sparkle", text("yes"));

        // When
        LoweredProps props = lower(text, false);

        // Then
        assertThat(printed(props, "sparkle")).isEqualTo("\"yes\"");
        assertThat(diagnostics.all()).extracting(Diagnostic::severity).containsExactly(Severity.WARNING);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void lower_invalidDpValue_reportsEveryBadProp() {
        // Given
        MarkupNode column = node("Column", "padding", text("wide"), "w", text("tall"));

        // When
        lower(column, true);

        // Then
        assertThat(diagnostics.all()).hasSize(2);
        assertThat(diagnostics.all().get(0).message())
            .isEqualTo("Invalid value 'wide' for Column.padding (expected dp)");
    }

    @Test
    void lower_callbackWithTooManyParameters_reportsError() {
        // Given
        Lambda handler = new Lambda(List.of("a", "b"), List.of(ExprNode.Call.of("go")), true);
        MarkupNode button = node("Button", "onClick", new PropValue.Lambda(handler));

        // When
        lower(button, true);

        // Then
        assertThat(diagnostics.all()).singleElement()
            .satisfies(d -> assertThat(d.message()).contains("takes 0 parameter(s) but the lambda declares 2"));
    }

    @Test
    void lowerUserComponent_everyPropBecomesNamedArgument() {
        // Given
        MarkupNode greeting = node("Greeting", "name", text("World"), "visible", new PropValue.Literal(Boolean.TRUE));

        // When
        LoweredProps props = new PropTransformer(new ExpressionTransformer(), diagnostics, true)
            .lowerUserComponent(greeting, ctx, SLOTS);

        // Then
        assertThat(printer.printArguments(props.arguments())).isEqualTo("(name = \"World\", visible = true)");
    }
}
