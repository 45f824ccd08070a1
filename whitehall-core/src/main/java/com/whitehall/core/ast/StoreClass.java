package com.whitehall.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code @store class Name { ... }} or {@code @store object Name { ... }}.
 *
 * @param name store name
 * @param singleton true for {@code object}
 * @param hilt true when the store is a Hilt view model ({@code @hilt} or an {@code @Inject} constructor)
 * @param constructorParameters raw primary constructor parameter text, or null
 * @param fields state fields in source order, all in {@link StateScope#STORE}
 * @param functions member functions in source order
 * @param initBlocks verbatim {@code init} block bodies
 * @param position source location
 */
public record StoreClass(
    String name,
    boolean singleton,
    boolean hilt,
    String constructorParameters,
    List<StateVar> fields,
    List<FunctionDeclaration> functions,
    List<CodeBlock> initBlocks,
    SourcePosition position
) implements Declaration {

    public StoreClass {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(position, "position must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
        functions = functions != null ? List.copyOf(functions) : List.of();
        initBlocks = initBlocks != null ? List.copyOf(initBlocks) : List.of();
    }

    /**
     * Finds a field by name.
     *
     * @param fieldName field name
     * @return the field, or null
     */
    public StateVar field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst().orElse(null);
    }

    /**
     * Whether the author declared a function with this name.
     *
     * @param functionName function name
     * @return true if declared
     */
    public boolean declaresFunction(String functionName) {
        return functions.stream().anyMatch(f -> f.name().equals(functionName));
    }
}
