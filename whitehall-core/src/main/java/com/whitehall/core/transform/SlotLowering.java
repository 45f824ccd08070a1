package com.whitehall.core.transform;

import com.whitehall.core.ast.MarkupNode;
import com.whitehall.core.ir.UiNode;

import java.util.List;

/**
 * Lowers markup passed as a prop value; supplied by the markup lowering.
 */
@FunctionalInterface
public interface SlotLowering {

    List<UiNode> lower(MarkupNode node);
}
