package com.whitehall.core.transform;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.ArrayLiteral;
import com.whitehall.core.ast.ExprNode.BinaryOp;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.Parenthesized;
import com.whitehall.core.ast.ExprNode.StringInterpolation;
import com.whitehall.core.ast.ExprNode.UnaryOp;
import com.whitehall.core.ast.StateVar;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Infers Kotlin types of state initializers from their literal shape.
 *
 * <p>Inference is deliberately shallow: literals, collections of literals, typed collection
 * factories and constructor calls. Anything else needs a declared type.
 */
public final class TypeInference {

    private TypeInference() {
        // Utility class - no instantiation
    }

    private static final Map<String, String> COLLECTION_FACTORIES = Map.of(
        "listOf", "List",
        "emptyList", "List",
        "mutableListOf", "MutableList",
        "setOf", "Set",
        "emptySet", "Set",
        "mutableSetOf", "MutableSet",
        "mapOf", "Map",
        "emptyMap", "Map",
        "mutableMapOf", "MutableMap"
    );

    private static final Set<String> COMPARISONS = Set.of(
        "==", "!=", "===", "!==", "<", ">", "<=", ">=", "&&", "||", "in", "!in", "is", "!is");

    private static final Map<String, String> NUMERIC_PARSERS = Map.of(
        "Int", "toIntOrNull",
        "Long", "toLongOrNull",
        "Double", "toDoubleOrNull",
        "Float", "toFloatOrNull"
    );

    /**
     * Declared type of a state variable, or the type inferred from its initializer.
     *
     * @param variable state variable
     * @return type text, or empty when it cannot be inferred
     */
    public static Optional<String> typeOf(StateVar variable) {
        if (variable.type() != null) {
            return Optional.of(variable.type());
        }
        return variable.initializer() != null ? infer(variable.initializer()) : Optional.empty();
    }

    /**
     * Infers the type of an expression.
     *
     * @param expr initializer
     * @return type text, or empty
     */
    public static Optional<String> infer(ExprNode expr) {
        if (expr instanceof Literal literal) {
            return literalType(literal);
        }
        if (expr instanceof StringInterpolation) {
            return Optional.of("String");
        }
        if (expr instanceof Parenthesized parenthesized) {
            return infer(parenthesized.inner());
        }
        if (expr instanceof UnaryOp unary) {
            return unary.operator().equals("!") ? Optional.of("Boolean") : infer(unary.operand());
        }
        if (expr instanceof BinaryOp binary) {
            if (COMPARISONS.contains(binary.operator())) {
                return Optional.of("Boolean");
            }
            Optional<String> left = infer(binary.left());
            return left.isPresent() && left.equals(infer(binary.right())) ? left : Optional.empty();
        }
        if (expr instanceof ArrayLiteral array) {
            return elementType(array.elements()).map(t -> "List<" + t + ">");
        }
        if (expr instanceof Call call && call.callee() instanceof Identifier callee) {
            return callType(call, callee.name());
        }
        return Optional.empty();
    }

    /**
     * Name of the parse function for a numeric type, used by text-field bindings.
     *
     * @param type Kotlin type
     * @return {@code toIntOrNull} and friends, or null for non-numeric types
     */
    public static String numericParser(String type) {
        return type == null ? null : NUMERIC_PARSERS.get(type);
    }

    private static Optional<String> callType(Call call, String name) {
        String collection = COLLECTION_FACTORIES.get(name);
        if (collection != null) {
            if (call.typeArguments() != null) {
                return Optional.of(collection + call.typeArguments());
            }
            if (collection.endsWith("Map")) {
                return Optional.empty();
            }
            List<ExprNode> elements = call.arguments().stream().map(Argument::value).toList();
            return elementType(elements).map(t -> collection + "<" + t + ">");
        }
        if (!name.isEmpty() && Character.isUpperCase(name.charAt(0))) {
            return Optional.of(call.typeArguments() != null ? name + call.typeArguments() : name);
        }
        return Optional.empty();
    }

    private static Optional<String> elementType(List<ExprNode> elements) {
        if (elements.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> first = infer(elements.get(0));
        for (ExprNode element : elements) {
            if (!infer(element).equals(first)) {
                return Optional.empty();
            }
        }
        return first;
    }

    private static Optional<String> literalType(Literal literal) {
        String text = literal.text();
        return switch (literal.kind()) {
            case STRING -> Optional.of("String");
            case CHAR -> Optional.of("Char");
            case BOOLEAN -> Optional.of("Boolean");
            case NULL -> Optional.empty();
            case NUMBER -> Optional.of(numberType(text));
        };
    }

    private static String numberType(String text) {
        String lower = text.toLowerCase();
        if (lower.startsWith("0x") || lower.startsWith("0b")) {
            return lower.endsWith("l") ? "Long" : "Int";
        }
        if (lower.endsWith("f")) {
            return "Float";
        }
        if (lower.endsWith("l")) {
            return "Long";
        }
        if (lower.contains(".") || lower.contains("e")) {
            return "Double";
        }
        return "Int";
    }
}
