package com.whitehall.core.registry;

import java.util.Objects;

/**
 * Lowering rule for one prop of a component.
 *
 * @param name prop name as written in markup, such as {@code padding} or {@code bind:value}
 * @param kind lowering kind
 * @param format value conversion
 * @param target argument name, or modifier function for {@link PropKind#MODIFIER_CHAIN};
 *               null means the prop name
 * @param arity parameter count of a {@link PropKind#CALLBACK}
 * @param callback change callback argument of a {@link PropKind#BINDING}, or null
 */
public record PropSpec(
    String name,
    PropKind kind,
    ValueFormat format,
    String target,
    int arity,
    String callback
) {

    public PropSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        format = format != null ? format : ValueFormat.RAW;
        target = target != null ? target : name;
        if (arity < 0) {
            throw new IllegalArgumentException("arity must not be negative: " + arity);
        }
        if (kind == PropKind.BINDING && callback == null) {
            throw new IllegalArgumentException("binding prop " + name + " needs a callback argument");
        }
    }

    public static PropSpec plain(String name) {
        return new PropSpec(name, PropKind.PLAIN, ValueFormat.RAW, null, 0, null);
    }

    public static PropSpec plain(String name, ValueFormat format) {
        return new PropSpec(name, PropKind.PLAIN, format, null, 0, null);
    }

    public static PropSpec plain(String name, ValueFormat format, String target) {
        return new PropSpec(name, PropKind.PLAIN, format, target, 0, null);
    }

    public static PropSpec slot(String name) {
        return new PropSpec(name, PropKind.COMPOSABLE_SLOT, ValueFormat.RAW, null, 0, null);
    }

    public static PropSpec modifier(String name, ValueFormat format, String function) {
        return new PropSpec(name, PropKind.MODIFIER_CHAIN, format, function, 0, null);
    }

    public static PropSpec callback(String name, int arity) {
        return new PropSpec(name, PropKind.CALLBACK, ValueFormat.RAW, null, arity, null);
    }

    public static PropSpec binding(String name, String valueArgument, String callbackArgument) {
        return new PropSpec(name, PropKind.BINDING, ValueFormat.RAW, valueArgument, 1, callbackArgument);
    }

    public static PropSpec childText(String name) {
        return new PropSpec(name, PropKind.CHILD_TEXT, ValueFormat.RAW, null, 0, null);
    }
}
