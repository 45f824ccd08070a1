package com.whitehall.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Markup element {@code <Tag prop=value>children</Tag>}.
 *
 * @param tag tag name
 * @param props props in source order; keys are unique
 * @param children children in source order
 * @param position location of the opening {@code <}
 */
public record MarkupNode(
    String tag,
    Map<String, PropValue> props,
    List<MarkupChild> children,
    SourcePosition position
) implements MarkupChild {

    public MarkupNode {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(position, "position must not be null");
        props = props != null ? Collections.unmodifiableMap(new LinkedHashMap<>(props)) : Map.of();
        children = children != null ? List.copyOf(children) : List.of();
    }

    /**
     * Returns a copy of this node with different props.
     *
     * @param newProps replacement props
     * @return new node
     */
    public MarkupNode withProps(Map<String, PropValue> newProps) {
        return new MarkupNode(tag, newProps, children, position);
    }
}
