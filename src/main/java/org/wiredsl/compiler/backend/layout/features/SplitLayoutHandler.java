package org.wiredsl.compiler.backend.layout.features;

import org.wiredsl.compiler.backend.layout.IContainerLayoutHandler;
import org.wiredsl.compiler.backend.layout.LayoutContext;
import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.List;

/**
 * Handles split containers: a fixed-width panel beside a flexible one, separated by the gap.
 */
public final class SplitLayoutHandler implements IContainerLayoutHandler {

	@Override
	public void layout(IrContainerNode node, double x, double y, double width, double height, LayoutContext ctx) {
		List<NodeRef> children = node.children();
		double[] widths = ctx.estimator().splitWidths(node, width);
		double gap = ctx.spacing(node.style().gap());
		double currentX = x;
		for (int i = 0; i < widths.length; i++) {
			ctx.place(children.get(i).ref(), currentX, y, widths[i], height, ContainerType.SPLIT);
			currentX += widths[i] + gap;
		}
		ctx.collapse(children, widths.length, x, y, ContainerType.SPLIT);
	}
}
