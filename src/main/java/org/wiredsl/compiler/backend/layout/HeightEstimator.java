package org.wiredsl.compiler.backend.layout;

import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrComponentNode;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.IrNode;
import org.wiredsl.compiler.ir.IrValue;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Top-down size estimates used before a node is placed: how tall a child will be at a given width,
 * how a horizontal row or a split divides its width, and how grid cells pack into rows.
 */
public final class HeightEstimator {

    /** Column count of a grid that declares none. */
    public static final int DEFAULT_COLUMNS = 12;

    /**
     * Position of one grid child after row packing.
     *
     * @param row  Zero-based row index.
     * @param col  Zero-based start column.
     * @param span Number of columns covered.
     */
    public record GridSlot(int row, int col, int span) {}

    private final LayoutContext ctx;

    HeightEstimator(LayoutContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Height of a node at the given width: an explicit component height, else the estimated
     * content height of a container, else the intrinsic component height.
     */
    public double measure(String nodeId, double width) {
        return measure(ctx.node(nodeId).orElse(null), width);
    }

    public double measure(IrNode node, double width) {
        if (node instanceof IrComponentNode component) {
            OptionalDouble explicit = IntrinsicSizer.positive(component.props(), "height");
            return explicit.isPresent() ? explicit.getAsDouble() : ctx.sizer().height(component, width);
        }
        if (node instanceof IrContainerNode container) {
            return containerHeight(container, width);
        }
        return ctx.sizer().defaultHeight();
    }

    /**
     * Estimates the content height of a container, padding included.
     *
     * @param node  The container.
     * @param width The outer width the container will receive.
     * @return The estimated height.
     */
    public double containerHeight(IrContainerNode node, double width) {
        double padding = ctx.spacing(node.style().padding());
        double gap = ctx.spacing(node.style().gap());
        double inner = Math.max(0, width - padding * 2);
        List<NodeRef> children = node.children();
        double content = 0;

        if (node.containerType() == ContainerType.GRID) {
            int columns = columns(node);
            double colWidth = (inner - gap * (columns - 1)) / columns;
            List<GridSlot> slots = packGrid(node, columns);
            List<Double> rowHeights = new ArrayList<>();
            for (int i = 0; i < children.size(); i++) {
                GridSlot slot = slots.get(i);
                double h = measure(children.get(i).ref(), colWidth * slot.span() + gap * (slot.span() - 1));
                while (rowHeights.size() <= slot.row()) rowHeights.add(0.0);
                rowHeights.set(slot.row(), Math.max(rowHeights.get(slot.row()), h));
            }
            for (int r = 0; r < rowHeights.size(); r++) {
                content += rowHeights.get(r) + (r < rowHeights.size() - 1 ? gap : 0);
            }
        } else if (node.containerType() == ContainerType.STACK && !isVertical(node)) {
            double[] widths = rowWidths(node, inner);
            for (int i = 0; i < children.size(); i++) {
                content = Math.max(content, measure(children.get(i).ref(), widths[i]));
            }
        } else if (node.containerType() == ContainerType.SPLIT) {
            double[] widths = splitWidths(node, inner);
            for (int i = 0; i < widths.length; i++) {
                content = Math.max(content, measure(children.get(i).ref(), widths[i]));
            }
        } else if (node.containerType() == ContainerType.PANEL) {
            if (!children.isEmpty()) content = measure(children.get(0).ref(), inner);
        } else {
            for (int i = 0; i < children.size(); i++) {
                content += measure(children.get(i).ref(), inner);
                if (i < children.size() - 1) content += gap;
            }
        }
        return content + padding * 2;
    }

    /**
     * Widths of the children of a horizontal stack. Rows that justify or stretch share the width
     * equally; all other rows use each child's natural width.
     *
     * @param node  The horizontal stack.
     * @param width The inner width of the row.
     * @return One width per child.
     */
    public double[] rowWidths(IrContainerNode node, double width) {
        List<NodeRef> children = node.children();
        int n = children.size();
        double[] widths = new double[n];
        if (n == 0) return widths;
        if (usesEqualWidths(node)) {
            double gap = ctx.spacing(node.style().gap());
            double shared = (width - gap * (n - 1)) / n;
            Arrays.fill(widths, shared);
            return widths;
        }
        for (int i = 0; i < n; i++) {
            widths[i] = naturalWidth(ctx.node(children.get(i).ref()).orElse(null));
        }
        return widths;
    }

    /**
     * Widths of the panels of a split. A single child takes the full width. With two or more children
     * the first two are placed; a {@code right} param fixes the second panel, otherwise {@code left}
     * or {@code sidebar} (or the configured default) fixes the first.
     *
     * @param node  The split.
     * @param width The inner width.
     * @return One width per placed child (zero, one or two entries).
     */
    public double[] splitWidths(IrContainerNode node, double width) {
        int n = node.children().size();
        if (n == 0) return new double[0];
        if (n == 1) return new double[] {width};
        double gap = ctx.spacing(node.style().gap());
        Map<String, IrValue> params = node.params();
        OptionalDouble right = IntrinsicSizer.positive(params, "right");
        if (right.isPresent()) {
            return new double[] {width - right.getAsDouble() - gap, right.getAsDouble()};
        }
        OptionalDouble left = IntrinsicSizer.positive(params, "left");
        if (left.isEmpty()) left = IntrinsicSizer.positive(params, "sidebar");
        double fixed = left.orElse(ctx.options().splitSidebarWidth());
        return new double[] {fixed, width - fixed - gap};
    }

    /**
     * Packs grid children into rows: a child that does not fit the remaining columns starts a new row.
     * Only cells carry a span; any other child spans one column.
     *
     * @param node    The grid.
     * @param columns The column count.
     * @return One slot per child.
     */
    public List<GridSlot> packGrid(IrContainerNode node, int columns) {
        List<GridSlot> slots = new ArrayList<>();
        int row = 0;
        int col = 0;
        for (NodeRef ref : node.children()) {
            int span = span(ctx.node(ref.ref()), columns);
            if (col + span > columns) {
                row++;
                col = 0;
            }
            slots.add(new GridSlot(row, col, span));
            col += span;
        }
        return slots;
    }

    /**
     * @return The width prop of a component, else its intrinsic width; containers use the default width.
     */
    public double naturalWidth(IrNode node) {
        if (node instanceof IrComponentNode component) {
            OptionalDouble explicit = IntrinsicSizer.positive(component.props(), "width");
            return explicit.isPresent() ? explicit.getAsDouble() : ctx.sizer().width(component);
        }
        return ctx.sizer().defaultWidth();
    }

    public static boolean isVertical(IrContainerNode node) {
        IrValue direction = node.params().get("direction");
        return direction == null || "vertical".equals(direction.asText());
    }

    public static int columns(IrContainerNode node) {
        OptionalDouble columns = IntrinsicSizer.positive(node.params(), "columns");
        return columns.isPresent() ? Math.max(1, (int) columns.getAsDouble()) : DEFAULT_COLUMNS;
    }

    private static int span(Optional<IrNode> child, int columns) {
        if (child.isPresent() && child.get() instanceof IrContainerNode container && container.isCell()) {
            OptionalDouble span = IntrinsicSizer.positive(container.params(), "span");
            if (span.isPresent()) return Math.min(columns, Math.max(1, (int) span.getAsDouble()));
        }
        return 1;
    }

    private static boolean usesEqualWidths(IrContainerNode node) {
        String justify = node.style().justify();
        if (justify != null) return "stretch".equals(justify);
        String align = node.style().align();
        return align == null || "justify".equals(align);
    }
}
