package com.whitehall.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from component name to its prop shapes.
 *
 * <p>The registry is immutable; {@link #withComponents(Collection)} returns an extended copy, so a
 * registry can be shared by concurrent compilations.
 */
public final class ComponentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private static final ComponentRegistry DEFAULTS = new ComponentRegistry(ComposeComponents.ALL);

    private final Map<String, ComponentSpec> components;

    private ComponentRegistry(Collection<ComponentSpec> specs) {
        Map<String, ComponentSpec> byName = new LinkedHashMap<>();
        for (ComponentSpec spec : specs) {
            byName.put(spec.name(), spec);
        }
        this.components = Map.copyOf(byName);
    }

    /**
     * Registry with the built-in components only.
     *
     * @return default registry
     */
    public static ComponentRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a registry with extra components; an extra component replaces a built-in one with
     * the same name.
     *
     * @param extra components to add
     * @return extended registry
     */
    public ComponentRegistry withComponents(Collection<ComponentSpec> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        Map<String, ComponentSpec> merged = new LinkedHashMap<>(components);
        for (ComponentSpec spec : extra) {
            if (merged.containsKey(spec.name())) {
                log.debug("Component {} overridden by configuration", spec.name());
            }
            merged.put(spec.name(), spec);
        }
        return new ComponentRegistry(merged.values());
    }

    public Optional<ComponentSpec> find(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public boolean contains(String name) {
        return components.containsKey(name);
    }

    /**
     * All registered components sorted by name.
     *
     * @return components
     */
    public List<ComponentSpec> all() {
        return components.values().stream()
            .sorted((a, b) -> a.name().compareTo(b.name()))
            .toList();
    }
}
