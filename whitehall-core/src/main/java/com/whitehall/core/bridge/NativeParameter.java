package com.whitehall.core.bridge;

import java.util.Objects;

/**
 * Parameter of a native function signature.
 *
 * @param name parameter name
 * @param type declared type text
 */
public record NativeParameter(String name, String type) {

    public NativeParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
