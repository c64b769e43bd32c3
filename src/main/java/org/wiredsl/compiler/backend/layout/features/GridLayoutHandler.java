package org.wiredsl.compiler.backend.layout.features;

import org.wiredsl.compiler.backend.layout.HeightEstimator;
import org.wiredsl.compiler.backend.layout.IContainerLayoutHandler;
import org.wiredsl.compiler.backend.layout.LayoutContext;
import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.List;

/**
 * Handles grid containers in three passes: measure every child at its cell width, pack children into
 * rows by span, then position each child with its row's height.
 */
public final class GridLayoutHandler implements IContainerLayoutHandler {

	@Override
	public void layout(IrContainerNode node, double x, double y, double width, double height, LayoutContext ctx) {
		List<NodeRef> children = node.children();
		if (children.isEmpty()) return;

		int columns = HeightEstimator.columns(node);
		double gap = ctx.spacing(node.style().gap());
		double colWidth = (width - gap * (columns - 1)) / columns;
		List<HeightEstimator.GridSlot> slots = ctx.estimator().packGrid(node, columns);

		int rows = slots.get(slots.size() - 1).row() + 1;
		double[] rowHeights = new double[rows];
		for (int i = 0; i < children.size(); i++) {
			HeightEstimator.GridSlot slot = slots.get(i);
			double cellHeight = ctx.estimator().measure(children.get(i).ref(), cellWidth(colWidth, gap, slot.span()));
			rowHeights[slot.row()] = Math.max(rowHeights[slot.row()], cellHeight);
		}

		double[] rowTops = new double[rows];
		double top = y;
		for (int r = 0; r < rows; r++) {
			rowTops[r] = top;
			top += rowHeights[r] + gap;
		}

		for (int i = 0; i < children.size(); i++) {
			HeightEstimator.GridSlot slot = slots.get(i);
			double cellX = x + slot.col() * (colWidth + gap);
			ctx.place(children.get(i).ref(), cellX, rowTops[slot.row()], cellWidth(colWidth, gap, slot.span()),
					rowHeights[slot.row()], ContainerType.GRID);
		}
	}

	private static double cellWidth(double colWidth, double gap, int span) {
		return colWidth * span + gap * (span - 1);
	}
}
