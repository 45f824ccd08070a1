package com.whitehall.core.transform;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.ArrayLiteral;
import com.whitehall.core.ast.ExprNode.Assignment;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.Lambda;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.ExprNode.Segment;
import com.whitehall.core.ast.ExprNode.StringInterpolation;
import com.whitehall.core.ast.ExprNode.Ternary;
import com.whitehall.core.ast.ExprNode.UnaryOp;
import com.whitehall.core.ast.SourcePosition;
import com.whitehall.core.ast.StateScope;
import com.whitehall.core.ast.StateVar;
import com.whitehall.core.ast.StoreClass;
import com.whitehall.core.diagnostic.DiagnosticKind;
import com.whitehall.core.diagnostic.ScopeViolationError;
import com.whitehall.core.emit.ExpressionPrinter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ExpressionTransformer}.
 */
class ExpressionTransformerTest {

    private static final SourcePosition POS = new SourcePosition(3, 5);

    private ExpressionTransformer transformer;
    private ExpressionPrinter printer;
    private StoreClass counterStore;
    private TransformContext componentContext;

    @BeforeEach
    void setUp() {
        transformer = new ExpressionTransformer();
        printer = new ExpressionPrinter();
        counterStore = new StoreClass("CounterStore", false, false, null,
            List.of(
                field("count", true, StateVar.Kind.PLAIN, false),
                field("doubled", false, StateVar.Kind.COMPUTED, false),
                field("secret", true, StateVar.Kind.PLAIN, true)),
            List.of(), List.of(), POS);
        StateVar title = new StateVar("title", null, Literal.string("x"), false, StateScope.LOCAL,
            StateVar.Kind.PLAIN, false, POS);
        ScopeSymbols symbols = new ScopeSymbols(
            Map.of("title", title),
            Map.of("counter", StoreBinding.of("counter", counterStore)),
            null,
            null);
        componentContext = TransformContext.forComponent("counter.wh", "Counter", symbols);
    }

    private static StateVar field(String name, boolean mutable, StateVar.Kind kind, boolean privateMember) {
        return new StateVar(name, "Int", Literal.number("0"), mutable, StateScope.STORE, kind, privateMember, POS);
    }

    private static MemberAccess counter(String member) {
        return new MemberAccess(new Identifier("counter"), member, false);
    }

    private String transformAndPrint(ExprNode expr, TransformContext ctx) {
        return printer.print(transformer.transform(expr, ctx));
    }

    @Test
    void transform_nestedTernary_becomesIfElseChain() {
        // Given
        ExprNode expr = new Ternary(new Identifier("a"), Literal.string("x"),
            new Ternary(new Identifier("b"), Literal.string("y"), Literal.string("z")));

        // When
        String kotlin = transformAndPrint(expr, componentContext);

        // Then
        assertThat(kotlin).isEqualTo("if (a) \"x\" else if (b) \"y\" else \"z\"");
    }

    @Test
    void transform_ternaryInsideInterpolation_isRewrittenToo() {
        // Given
        ExprNode expr = new StringInterpolation(List.of(
            Segment.text("Status: "),
            Segment.expr(new Ternary(new Identifier("done"), Literal.string("yes"), Literal.string("no")))));

        // When
        String kotlin = transformAndPrint(expr, componentContext);

        // Then
        assertThat(kotlin).isEqualTo("\"Status: ${if (done) \"yes\" else \"no\"}\"");
    }

    @Test
    void transform_arrowLambdaWithTwoParameters_becomesBraceLambda() {
        // Given
        ExprNode lambda = new Lambda(List.of("a", "b"),
            List.of(new BinaryOp(new Identifier("a"), "+", new Identifier("b"))), true);

        // When
        ExprNode result = transformer.transform(lambda, componentContext);

        // Then
        assertThat(((Lambda) result).arrow()).isFalse();
        assertThat(printer.print(result)).isEqualTo("{ a, b -> a + b }");
    }

    @Test
    void transform_arrayLiteral_becomesListOf() {
        // Given
        ExprNode array = new ArrayLiteral(List.of(Literal.number("1"), Literal.number("2")));

        // When / Then
        assertThat(transformAndPrint(array, componentContext)).isEqualTo("listOf(1, 2)");
    }

    @Test
    void transform_storeFieldRead_readsCollectedSnapshot() {
        assertThat(transformAndPrint(counter("count"), componentContext)).isEqualTo("counterState.count");
    }

    @Test
    void transform_storeFieldIncrement_callsUpdateMethod() {
        // Given
        ExprNode increment = new UnaryOp("++", counter("count"), true);

        // When / Then
        assertThat(transformAndPrint(increment, componentContext))
            .isEqualTo("counter.updateCount(counter.count + 1)");
    }

    @Test
    void transform_storeFieldAssignment_callsUpdateMethod() {
        // Given
        ExprNode assignment = new Assignment(counter("count"), "=", Literal.number("5"), POS);

        // When / Then
        assertThat(transformAndPrint(assignment, componentContext)).isEqualTo("counter.updateCount(5)");
    }

    @Test
    void transform_storeMethodCall_isLeftAlone() {
        // Given
        ExprNode call = new Call(counter("reset"), null, List.of(), null);

        // When / Then
        assertThat(transformAndPrint(call, componentContext)).isEqualTo("counter.reset()");
    }

    @Test
    void transform_assignmentToComputedField_throwsScopeViolation() {
        // Given
        ExprNode assignment = new Assignment(counter("doubled"), "=", Literal.number("1"), POS);

        // When / Then
        assertThatThrownBy(() -> transformer.transform(assignment, componentContext))
            .isInstanceOf(ScopeViolationError.class)
            .hasMessageContaining("computed value")
            .hasMessageStartingWith("counter.wh:3:5:");
    }

    @Test
    void transform_privateFieldRead_throwsScopeViolation() {
        assertThatThrownBy(() -> transformer.transform(counter("secret"), componentContext))
            .isInstanceOf(ScopeViolationError.class)
            .hasMessageContaining("private to store CounterStore");
    }

    @Test
    void transform_writeThroughSnapshot_throwsScopeViolation() {
        // Given
        ExprNode assignment = new Assignment(
            new MemberAccess(new Identifier("counterState"), "count", false), "=", Literal.number("1"), POS);

        // When / Then
        assertThatThrownBy(() -> transformer.transform(assignment, componentContext))
            .isInstanceOf(ScopeViolationError.class)
            .hasMessageContaining("state snapshot 'counterState'");
    }

    @Test
    void transform_inPlaceMutationOfStoreState_throwsScopeViolation() {
        // Given
        ExprNode assignment = new Assignment(
            new MemberAccess(counter("count"), "value", false), "=", Literal.number("1"), POS);

        // When / Then
        assertThatThrownBy(() -> transformer.transform(assignment, componentContext))
            .isInstanceOf(ScopeViolationError.class)
            .hasMessageContaining("cannot be mutated in place");
    }

    @Test
    void transform_incrementInsideInterpolation_throwsScopeViolation() {
        // Given
        ExprNode text = new StringInterpolation(List.of(
            Segment.text("Count: "),
            Segment.expr(new UnaryOp("++", new Identifier("count"), true))));

        // When / Then
        assertThatThrownBy(() -> transformer.transform(text, componentContext))
            .isInstanceOf(ScopeViolationError.class)
            .satisfies(e -> assertThat(((ScopeViolationError) e).diagnostic().kind())
                .isEqualTo(DiagnosticKind.SCOPE_VIOLATION))
            .hasMessageContaining("text interpolation");
    }

    @Test
    void transform_writeToLocalVal_throwsScopeViolation() {
        // Given
        ExprNode assignment = new Assignment(new Identifier("title"), "=", Literal.string("y"), POS);

        // When / Then
        assertThatThrownBy(() -> transformer.transform(assignment, componentContext))
            .isInstanceOf(ScopeViolationError.class)
            .hasMessageContaining("declared with val");
    }

    @Test
    void transform_compoundAssignmentInsideStore_callsOwnUpdateMethod() {
        // Given
        TransformContext storeContext = TransformContext.forStore("counter.wh", counterStore);
        ExprNode assignment = new Assignment(new Identifier("count"), "+=", Literal.number("2"), POS);

        // When / Then
        assertThat(transformAndPrint(assignment, storeContext)).isEqualTo("updateCount(count + 2)");
    }

    @Test
    void transform_assignmentInsideOwnUpdateMethod_writesStateDirectly() {
        // Given
        TransformContext storeContext = TransformContext.forStore("counter.wh", counterStore)
            .inFunction("updateCount");
        ExprNode assignment = new Assignment(new Identifier("count"), "=", new Identifier("value"), POS);

        // When / Then
        assertThat(transformAndPrint(assignment, storeContext))
            .isEqualTo("_uiState.update { it.copy(count = value) }");
    }

    @Test
    void transform_privateFieldWriteInsideStore_staysPlainAssignment() {
        // Given
        TransformContext storeContext = TransformContext.forStore("counter.wh", counterStore);
        ExprNode assignment = new Assignment(new Identifier("secret"), "=", Literal.number("1"), POS);

        // When / Then
        assertThat(transformAndPrint(assignment, storeContext)).isEqualTo("secret = 1");
    }

    @Test
    void transform_ioBlock_launchesInScope() {
        // Given
        ExprNode io = new Call(new Identifier("io"), null, List.of(),
            new Lambda(List.of(), List.of(Call.of("load")), false));

        // When
        String inComponent = transformAndPrint(io, componentContext);
        String inStore = transformAndPrint(io, TransformContext.forStore("counter.wh", counterStore));

        // Then
        assertThat(inComponent).isEqualTo("dispatcherScope.launch(Dispatchers.IO) { load() }");
        assertThat(inStore).isEqualTo("viewModelScope.launch(Dispatchers.IO) { load() }");
    }

    @Test
    void updateMethodName_capitalizesField() {
        assertThat(ExpressionTransformer.updateMethodName("count")).isEqualTo("updateCount");
        assertThat(ExpressionTransformer.updateMethodName("isLoading")).isEqualTo("updateIsLoading");
    }
}
