package com.whitehall.core.transform;

import com.whitehall.core.ast.StateVar;
import com.whitehall.core.ast.StoreClass;

import java.util.Map;
import java.util.Optional;

/**
 * Names a transform can resolve in its scope.
 *
 * @param localState component state variables by name
 * @param bindings store bindings by binding name
 * @param currentStore the store whose members are being transformed, or null in a component
 * @param dispatchScope coroutine scope expression used by dispatch blocks
 */
public record ScopeSymbols(
    Map<String, StateVar> localState,
    Map<String, StoreBinding> bindings,
    StoreClass currentStore,
    String dispatchScope
) {

    public static final String COMPONENT_SCOPE = "dispatcherScope";

    public ScopeSymbols {
        localState = localState != null ? Map.copyOf(localState) : Map.of();
        bindings = bindings != null ? Map.copyOf(bindings) : Map.of();
        dispatchScope = dispatchScope != null ? dispatchScope : COMPONENT_SCOPE;
    }

    /**
     * Symbols of a component without state, such as a helper composable.
     *
     * @return empty symbols
     */
    public static ScopeSymbols empty() {
        return new ScopeSymbols(Map.of(), Map.of(), null, COMPONENT_SCOPE);
    }

    public Optional<StoreBinding> binding(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * Finds the binding whose collected snapshot has this name.
     *
     * @param stateName snapshot name such as {@code counterState}
     * @return the binding, or empty
     */
    public Optional<StoreBinding> bindingForState(String stateName) {
        return bindings.values().stream().filter(b -> b.stateName().equals(stateName)).findFirst();
    }
}
