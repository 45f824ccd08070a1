package com.whitehall.core.transform;

import com.whitehall.core.ast.StoreClass;

import java.util.Objects;

/**
 * A store instance visible in a component.
 *
 * @param name binding name, {@code counter} in {@code val counter = CounterStore()}
 * @param store the bound store
 * @param stateName name of the collected snapshot, {@code counterState}
 */
public record StoreBinding(String name, StoreClass store, String stateName) {

    public StoreBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(stateName, "stateName must not be null");
    }

    /**
     * Binding for a store, named {@code <name>State} for the snapshot.
     *
     * @param name binding name
     * @param store store class
     * @return binding
     */
    public static StoreBinding of(String name, StoreClass store) {
        String base = Character.toLowerCase(name.charAt(0)) + name.substring(1);
        return new StoreBinding(name, store, base + "State");
    }
}
