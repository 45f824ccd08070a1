package com.whitehall.core.ast;

import java.util.Objects;

/**
 * Class-like declaration copied verbatim into the output: {@code data class}, {@code enum class},
 * {@code sealed class}, plain {@code class}, {@code object} or {@code typealias}.
 *
 * @param name declared name
 * @param code full declaration text
 * @param position source location
 */
public record DataClass(String name, String code, SourcePosition position) implements Declaration {

    public DataClass {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
