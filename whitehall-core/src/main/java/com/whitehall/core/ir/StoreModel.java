package com.whitehall.core.ir;

import com.whitehall.core.ast.ExprNode;

import java.util.List;
import java.util.Objects;

/**
 * Reactive state container synthesized from a store class.
 *
 * @param name store name
 * @param singleton true for {@code object} stores
 * @param hilt true for Hilt view models
 * @param constructorParameters constructor parameter text, or null
 * @param stateClassName name of the nested state data class
 * @param fields state fields held in the container, in declaration order
 * @param updates generated update methods
 * @param computed computed and derived read-only properties
 * @param privateFields private members kept as plain fields
 * @param methods user methods with rewritten bodies
 * @param initBlocks rewritten {@code init} bodies
 * @param ownScope true when an object store launches coroutines and needs its own scope
 */
public record StoreModel(
    String name,
    boolean singleton,
    boolean hilt,
    String constructorParameters,
    String stateClassName,
    List<StateField> fields,
    List<UpdateMethod> updates,
    List<ComputedProperty> computed,
    List<PrivateField> privateFields,
    List<StoreMethod> methods,
    List<String> initBlocks,
    boolean ownScope
) {

    public StoreModel {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(stateClassName, "stateClassName must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
        updates = updates != null ? List.copyOf(updates) : List.of();
        computed = computed != null ? List.copyOf(computed) : List.of();
        privateFields = privateFields != null ? List.copyOf(privateFields) : List.of();
        methods = methods != null ? List.copyOf(methods) : List.of();
        initBlocks = initBlocks != null ? List.copyOf(initBlocks) : List.of();
    }

    /**
     * Coroutine scope used for launched work: {@code viewModelScope}, or the object's own scope.
     *
     * @return scope expression
     */
    public String coroutineScope() {
        return singleton ? "scope" : "viewModelScope";
    }

    /** Name of the private mutable flow, {@code _uiState} or {@code _state}. */
    public String backingFlow() {
        return "_" + publicFlow();
    }

    /** Name of the public read-only flow, {@code uiState} or {@code state}. */
    public String publicFlow() {
        return singleton ? "state" : "uiState";
    }

    /** Field of the state data class with its read projection. */
    public record StateField(String name, String type, ExprNode initializer) {
        public StateField {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(initializer, "initializer must not be null");
        }
    }

    /** {@code fun name(value: type)} copying the state with {@code field} replaced. */
    public record UpdateMethod(String name, String field, String type) {
        public UpdateMethod {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** {@code val name[: type] get() = expression}. */
    public record ComputedProperty(String name, String type, ExprNode expression) {
        public ComputedProperty {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    /** {@code private var|val name[: type] = initializer}. */
    public record PrivateField(boolean mutable, String name, String type, ExprNode initializer) {
        public PrivateField {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * User method.
     *
     * @param signature {@code fun name(params): Type}
     * @param body rewritten body text
     * @param launched true when the body runs inside {@code viewModelScope.launch}
     */
    public record StoreMethod(String signature, String body, boolean launched) {
        public StoreMethod {
            Objects.requireNonNull(signature, "signature must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }
}
