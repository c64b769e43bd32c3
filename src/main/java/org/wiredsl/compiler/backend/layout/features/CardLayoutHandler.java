package org.wiredsl.compiler.backend.layout.features;

import org.wiredsl.compiler.backend.layout.HeightReconciler;
import org.wiredsl.compiler.backend.layout.IContainerLayoutHandler;
import org.wiredsl.compiler.backend.layout.LayoutContext;
import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.List;

/**
 * Handles card containers: children are stacked top-down inside the card's own padding.
 * The card receives its outer rectangle; its height is derived from the placed children afterwards.
 */
public final class CardLayoutHandler implements IContainerLayoutHandler {

	@Override
	public void layout(IrContainerNode node, double x, double y, double width, double height, LayoutContext ctx) {
		List<NodeRef> children = node.children();
		if (children.isEmpty()) return;

		double padding = ctx.padding(node);
		double gap = ctx.spacing(node.style().gap());
		double innerWidth = width - padding * 2;
		double currentY = y + padding;

		for (int i = 0; i < children.size(); i++) {
			String ref = children.get(i).ref();
			double childHeight = ctx.estimator().measure(ref, innerWidth);
			ctx.place(ref, x + padding, currentY, innerWidth, childHeight, ContainerType.CARD);
			currentY += childHeight;
			if (i < children.size() - 1) currentY += gap;
		}
		HeightReconciler.reconcile(children, y + padding, gap, ctx);
	}
}
