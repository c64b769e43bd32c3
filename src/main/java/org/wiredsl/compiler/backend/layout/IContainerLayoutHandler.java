package org.wiredsl.compiler.backend.layout;

import org.wiredsl.compiler.ir.IrContainerNode;

/**
 * Positions the children of one container kind inside the container's inner rectangle.
 */
public interface IContainerLayoutHandler {

    /**
     * Lays out the children of {@code node}.
     *
     * @param node   The container.
     * @param x      Left edge of the inner rectangle.
     * @param y      Top edge of the inner rectangle.
     * @param width  Width of the inner rectangle.
     * @param height Height of the inner rectangle; vertical stacks receive the unconstrained parent height.
     * @param ctx    The layout context used to place children.
     */
    void layout(IrContainerNode node, double x, double y, double width, double height, LayoutContext ctx);
}
