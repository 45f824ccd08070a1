package com.whitehall.core.ir;

import com.whitehall.core.ast.ExprNode;

import java.util.List;

/**
 * Composable lambda {@code { body }} used as an argument value, such as a slot prop.
 *
 * @param parameters lambda parameters
 * @param body lowered content
 */
public record ContentLambda(List<String> parameters, List<UiNode> body) implements ExprNode {

    public ContentLambda {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        body = body != null ? List.copyOf(body) : List.of();
    }

    public static ContentLambda of(List<UiNode> body) {
        return new ContentLambda(List.of(), body);
    }
}
