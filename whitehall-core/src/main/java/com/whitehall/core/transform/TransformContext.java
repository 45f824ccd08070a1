package com.whitehall.core.transform;

import com.whitehall.core.ast.StateScope;
import com.whitehall.core.ast.StoreClass;

import java.util.Map;
import java.util.Objects;

/**
 * Explicit context threaded through every transform call.
 *
 * @param fileName file being compiled, for diagnostics
 * @param insideInterpolation true while transforming an expression embedded in text
 * @param owningScope scope that owns the code being transformed
 * @param componentName enclosing composable or store name
 * @param symbols names resolvable in this scope
 * @param enclosingFunction store method whose body is being rewritten, or null
 */
public record TransformContext(
    String fileName,
    boolean insideInterpolation,
    StateScope owningScope,
    String componentName,
    ScopeSymbols symbols,
    String enclosingFunction
) {

    public TransformContext {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(owningScope, "owningScope must not be null");
        symbols = symbols != null ? symbols : ScopeSymbols.empty();
    }

    public static TransformContext forComponent(String fileName, String componentName, ScopeSymbols symbols) {
        return new TransformContext(fileName, false, StateScope.LOCAL, componentName, symbols, null);
    }

    /**
     * Context for the members of a store; dispatch blocks launch in the store's coroutine scope.
     *
     * @param fileName file name
     * @param store store being transformed
     * @return store context
     */
    public static TransformContext forStore(String fileName, StoreClass store) {
        String scope = store.singleton() ? "scope" : "viewModelScope";
        return new TransformContext(fileName, false, StateScope.STORE, store.name(),
            new ScopeSymbols(Map.of(), Map.of(), store, scope), null);
    }

    public TransformContext withInterpolation(boolean inside) {
        return inside == insideInterpolation
            ? this
            : new TransformContext(fileName, inside, owningScope, componentName, symbols, enclosingFunction);
    }

    public TransformContext inFunction(String functionName) {
        return new TransformContext(fileName, insideInterpolation, owningScope, componentName, symbols, functionName);
    }
}
