package org.wiredsl.compiler.backend.layout.features;

import org.wiredsl.compiler.backend.layout.IContainerLayoutHandler;
import org.wiredsl.compiler.backend.layout.LayoutContext;
import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrContainerNode;

/**
 * Handles panel containers, which pass their inner rectangle to a single child.
 * Any further child gets an empty box.
 */
public final class PanelLayoutHandler implements IContainerLayoutHandler {

	@Override
	public void layout(IrContainerNode node, double x, double y, double width, double height, LayoutContext ctx) {
		if (node.children().isEmpty()) return;
		ctx.place(node.children().get(0).ref(), x, y, width, height, ContainerType.PANEL);
		ctx.collapse(node.children(), 1, x, y, ContainerType.PANEL);
	}
}
