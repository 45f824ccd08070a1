package com.whitehall.core.registry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Prop shapes of one target component.
 *
 * @param name component name as used in markup and in the generated call
 * @param importPath fully qualified name to import, or null for scope members
 * @param children what the component does with its children
 * @param props prop rules keyed by prop name
 */
public record ComponentSpec(
    String name,
    String importPath,
    ChildrenMode children,
    Map<String, PropSpec> props
) {

    public ComponentSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(children, "children must not be null");
        props = props != null ? Map.copyOf(props) : Map.of();
    }

    /**
     * Builds a spec from a list of prop rules; later rules replace earlier ones with the same name.
     *
     * @param name component name
     * @param importPath import path
     * @param children children mode
     * @param props prop rules
     * @return the spec
     */
    public static ComponentSpec of(String name, String importPath, ChildrenMode children, List<PropSpec> props) {
        Map<String, PropSpec> byName = new LinkedHashMap<>();
        for (PropSpec prop : props) {
            byName.put(prop.name(), prop);
        }
        return new ComponentSpec(name, importPath, children, byName);
    }

    public Optional<PropSpec> prop(String propName) {
        return Optional.ofNullable(props.get(propName));
    }

    public boolean isLazyContainer() {
        return children == ChildrenMode.LAZY;
    }
}
