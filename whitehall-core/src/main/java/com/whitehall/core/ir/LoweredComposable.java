package com.whitehall.core.ir;

import com.whitehall.core.ast.Parameter;

import java.util.List;
import java.util.Objects;

/**
 * One generated {@code @Composable} function.
 *
 * @param name function name
 * @param parameters parameters in declaration order
 * @param body state declarations, effects and the lowered markup
 */
public record LoweredComposable(String name, List<Parameter> parameters, List<UiNode> body) {

    public LoweredComposable {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        body = body != null ? List.copyOf(body) : List.of();
    }
}
