package com.whitehall.core.transform;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.ArrayLiteral;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.LiteralKind;
import com.whitehall.core.ast.SourcePosition;
import com.whitehall.core.ast.StateScope;
import com.whitehall.core.ast.StateVar;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TypeInference}.
 */
class TypeInferenceTest {

    @Test
    void infer_numericLiterals_distinguishesSuffixes() {
        assertThat(TypeInference.infer(Literal.number("42"))).contains("Int");
        assertThat(TypeInference.infer(Literal.number("42L"))).contains("Long");
        assertThat(TypeInference.infer(Literal.number("1.5"))).contains("Double");
        assertThat(TypeInference.infer(Literal.number("1.5f"))).contains("Float");
        assertThat(TypeInference.infer(Literal.number("0xFF"))).contains("Int");
    }

    @Test
    void infer_otherLiterals_mapToKotlinTypes() {
        assertThat(TypeInference.infer(Literal.string("hi"))).contains("String");
        assertThat(TypeInference.infer(Literal.bool(true))).contains("Boolean");
        assertThat(TypeInference.infer(new Literal(LiteralKind.CHAR, "'c'"))).contains("Char");
        assertThat(TypeInference.infer(new Literal(LiteralKind.NULL, "null"))).isEmpty();
    }

    @Test
    void infer_comparison_isBoolean() {
        // Given
        ExprNode comparison = new BinaryOp(new Identifier("a"), "<", Literal.number("3"));

        // When / Then
        assertThat(TypeInference.infer(comparison)).contains("Boolean");
    }

    @Test
    void infer_homogeneousArrayLiteral_isTypedList() {
        // Given
        ExprNode array = new ArrayLiteral(List.of(Literal.string("a"), Literal.string("b")));
        ExprNode mixed = new ArrayLiteral(List.of(Literal.string("a"), Literal.number("1")));

        // When / Then
        assertThat(TypeInference.infer(array)).contains("List<String>");
        assertThat(TypeInference.infer(mixed)).isEmpty();
    }

    @Test
    void infer_collectionFactories_useTypeArgumentsOrElements() {
        // Given
        ExprNode typed = new Call(new Identifier("mutableListOf"), "<Todo>", List.of(), null);
        ExprNode fromElements = Call.of("setOf", Literal.number("1"), Literal.number("2"));
        ExprNode untypedMap = new Call(new Identifier("mapOf"), null,
            List.of(Argument.positional(new Identifier("pair"))), null);

        // When / Then
        assertThat(TypeInference.infer(typed)).contains("MutableList<Todo>");
        assertThat(TypeInference.infer(fromElements)).contains("Set<Int>");
        assertThat(TypeInference.infer(untypedMap)).isEmpty();
    }

    @Test
    void infer_constructorCall_isClassName() {
        assertThat(TypeInference.infer(Call.of("User", Literal.string("ann")))).contains("User");
        assertThat(TypeInference.infer(Call.of("loadUser"))).isEmpty();
    }

    @Test
    void typeOf_declaredType_winsOverInitializer() {
        // Given
        StateVar declared = new StateVar("total", "Double", Literal.number("0"), true, StateScope.LOCAL,
            StateVar.Kind.PLAIN, false, SourcePosition.UNKNOWN);

        // When / Then
        assertThat(TypeInference.typeOf(declared)).contains("Double");
    }

    @Test
    void numericParser_numericTypes_returnParseFunction() {
        assertThat(TypeInference.numericParser("Int")).isEqualTo("toIntOrNull");
        assertThat(TypeInference.numericParser("Double")).isEqualTo("toDoubleOrNull");
        assertThat(TypeInference.numericParser("String")).isNull();
        assertThat(TypeInference.numericParser(null)).isNull();
    }
}
