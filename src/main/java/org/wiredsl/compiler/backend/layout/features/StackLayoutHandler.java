package org.wiredsl.compiler.backend.layout.features;

import org.wiredsl.compiler.backend.layout.HeightEstimator;
import org.wiredsl.compiler.backend.layout.HeightReconciler;
import org.wiredsl.compiler.backend.layout.IContainerLayoutHandler;
import org.wiredsl.compiler.backend.layout.LayoutContext;
import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.List;

/**
 * Handles stack containers.
 * <p>
 * Vertical stacks place children top-down and then reconcile positions against the final heights.
 * Horizontal stacks either follow {@code align} (justify: equal widths; left, center, right: natural
 * widths) or, when the stack carries a {@code justify} distribution, distribute natural-width children
 * along the row and read {@code align} as the vertical alignment within the row.
 */
public final class StackLayoutHandler implements IContainerLayoutHandler {

	@Override
	public void layout(IrContainerNode node, double x, double y, double width, double height, LayoutContext ctx) {
		double gap = ctx.spacing(node.style().gap());
		if (HeightEstimator.isVertical(node)) {
			layoutVertical(node.children(), x, y, width, gap, ctx);
		} else {
			layoutHorizontal(node, x, y, width, gap, ctx);
		}
	}

	private void layoutVertical(List<NodeRef> children, double x, double y, double width, double gap, LayoutContext ctx) {
		double currentY = y;
		for (int i = 0; i < children.size(); i++) {
			String ref = children.get(i).ref();
			double childHeight = ctx.estimator().measure(ref, width);
			ctx.place(ref, x, currentY, width, childHeight, ContainerType.STACK);
			currentY += childHeight;
			if (i < children.size() - 1) currentY += gap;
		}
		HeightReconciler.reconcile(children, y, gap, ctx);
	}

	private void layoutHorizontal(IrContainerNode node, double x, double y, double width, double gap, LayoutContext ctx) {
		List<NodeRef> children = node.children();
		int n = children.size();
		if (n == 0) return;

		double[] widths = ctx.estimator().rowWidths(node, width);
		double[] heights = new double[n];
		double rowHeight = 0;
		double contentWidth = gap * (n - 1);
		for (int i = 0; i < n; i++) {
			heights[i] = ctx.estimator().measure(children.get(i).ref(), widths[i]);
			rowHeight = Math.max(rowHeight, heights[i]);
			contentWidth += widths[i];
		}

		String justify = node.style().justify();
		if (justify == null) {
			String align = mainAxisAlign(node.style().align());
			double currentX = x;
			if ("center".equals(align)) {
				currentX = x + (width - contentWidth) / 2;
			} else if ("right".equals(align)) {
				currentX = x + width - contentWidth;
			}
			for (int i = 0; i < n; i++) {
				ctx.place(children.get(i).ref(), currentX, y, widths[i], rowHeight, ContainerType.STACK);
				currentX += widths[i] + gap;
			}
			return;
		}

		double[] xs = distribute(justify, widths, x, width, gap);
		String crossAlign = crossAxisAlign(node.style().align());
		for (int i = 0; i < n; i++) {
			double childY = y;
			double childHeight = rowHeight;
			if (crossAlign != null) {
				childHeight = heights[i];
				if ("center".equals(crossAlign)) {
					childY = y + (rowHeight - childHeight) / 2;
				} else if ("end".equals(crossAlign)) {
					childY = y + rowHeight - childHeight;
				}
			}
			ctx.place(children.get(i).ref(), xs[i], childY, widths[i], childHeight, ContainerType.STACK);
		}
	}

	/**
	 * Computes the left edge of every child for a justify distribution.
	 */
	static double[] distribute(String justify, double[] widths, double x, double width, double gap) {
		int n = widths.length;
		double sum = 0;
		for (double w : widths) sum += w;
		double packed = sum + gap * (n - 1);

		double start = x;
		double step = gap;
		double margin = 0;
		switch (justify) {
			case "end":
				start = x + width - packed;
				break;
			case "center":
				start = x + (width - packed) / 2;
				break;
			case "spaceBetween":
				if (n > 1) step = Math.max(gap, (width - sum) / (n - 1));
				break;
			case "spaceAround":
				margin = Math.max(0, (width - packed) / (2 * n));
				start = x + margin;
				step = 2 * margin + gap;
				break;
			default:
				break;
		}

		double[] xs = new double[n];
		double current = start;
		for (int i = 0; i < n; i++) {
			xs[i] = current;
			current += widths[i] + step;
		}
		return xs;
	}

	/**
	 * Without a justify distribution, {@code start} and {@code end} read as {@code left} and {@code right}.
	 */
	static String mainAxisAlign(String align) {
		if (align == null) return "justify";
		if ("start".equals(align)) return "left";
		if ("end".equals(align)) return "right";
		return align;
	}

	private static String crossAxisAlign(String align) {
		if ("start".equals(align) || "center".equals(align) || "end".equals(align)) return align;
		return null;
	}
}
