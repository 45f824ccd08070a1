package com.whitehall.core.transform;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ir.UiNode;

import java.util.List;

/**
 * Result of lowering a node's props.
 *
 * @param arguments call arguments in prop order, the modifier chain last
 * @param leadingChildren content placed before the node's own children, such as a button label
 */
public record LoweredProps(List<ExprNode.Argument> arguments, List<UiNode> leadingChildren) {

    public LoweredProps {
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
        leadingChildren = leadingChildren != null ? List.copyOf(leadingChildren) : List.of();
    }
}
