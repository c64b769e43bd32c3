package org.wiredsl.compiler.backend.layout;

import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrComponentNode;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.IrNode;
import org.wiredsl.compiler.ir.IrStyle;
import org.wiredsl.compiler.ir.NodeRef;
import org.wiredsl.compiler.style.SpacingResolver;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Mutable state of one layout run: the node map, the project style, the parent container type of
 * every placed container and the accumulating boxes.
 */
public final class LayoutContext {

    private final Map<String, IrNode> nodes;
    private final IrStyle style;
    private final LayoutOptions options;
    private final ContainerLayoutRegistry registry;
    private final IntrinsicSizer sizer;
    private final HeightEstimator estimator;
    private final Map<String, LayoutBox> positions = new LinkedHashMap<>();
    private final Map<String, ContainerType> parentTypes = new HashMap<>();

    public LayoutContext(Map<String, IrNode> nodes, IrStyle style, LayoutOptions options, ContainerLayoutRegistry registry) {
        this.nodes = nodes;
        this.style = style;
        this.options = options;
        this.registry = registry;
        this.sizer = new IntrinsicSizer(style.density(), options);
        this.estimator = new HeightEstimator(this);
    }

    /**
     * Places a node and, for containers, all of its descendants. Unknown ids are ignored.
     *
     * @param nodeId     The node to place.
     * @param x          Left edge.
     * @param y          Top edge.
     * @param width      Available width.
     * @param height     Available height.
     * @param parentType Type of the containing container, or null for a screen root.
     */
    public void place(String nodeId, double x, double y, double width, double height, ContainerType parentType) {
        IrNode node = nodes.get(nodeId);
        if (node == null) return;
        if (node instanceof IrContainerNode container) {
            if (parentType != null) parentTypes.put(nodeId, parentType);
            placeContainer(container, x, y, width, height);
        } else {
            placeComponent((IrComponentNode) node, x, y, width);
        }
    }

    /**
     * Gives every child past {@code firstCollapsed} an empty box at the given origin, so surplus
     * children of panels and splits still appear in the position map.
     */
    public void collapse(List<NodeRef> children, int firstCollapsed, double x, double y, ContainerType parentType) {
        for (int i = firstCollapsed; i < children.size(); i++) {
            String ref = children.get(i).ref();
            place(ref, x, y, 0, 0, parentType);
            if (positions.containsKey(ref)) positions.put(ref, new LayoutBox(x, y, 0, 0));
        }
    }

    private void placeContainer(IrContainerNode node, double x, double y, double width, double height) {
        double padding = padding(node);
        boolean card = node.containerType() == ContainerType.CARD;
        boolean verticalStack = node.containerType() == ContainerType.STACK && HeightEstimator.isVertical(node);
        // Cards inset their children themselves.
        double inset = card ? 0 : padding;

        LayoutBox box = new LayoutBox(x, y, width, height);
        positions.put(node.id(), box);

        registry.resolve(node.containerType()).layout(node,
                x + inset,
                y + inset,
                Math.max(0, width - inset * 2),
                verticalStack ? height : Math.max(0, height - inset * 2),
                this);

        if (verticalStack || card) {
            double maxY = y;
            for (NodeRef child : node.children()) {
                LayoutBox childBox = positions.get(child.ref());
                if (childBox != null) maxY = Math.max(maxY, childBox.bottom());
            }
            box.setHeight(maxY - y + padding);
        }
    }

    private void placeComponent(IrComponentNode node, double x, double y, double width) {
        OptionalDouble explicitWidth = IntrinsicSizer.positive(node.props(), "width");
        double componentWidth = explicitWidth.isPresent() ? explicitWidth.getAsDouble() : width;
        OptionalDouble explicitHeight = IntrinsicSizer.positive(node.props(), "height");
        double componentHeight = explicitHeight.isPresent()
                ? explicitHeight.getAsDouble()
                : sizer.height(node, componentWidth);
        positions.put(node.id(), new LayoutBox(x, y, componentWidth, componentHeight));
    }

    /**
     * Resolved padding of a container. A grid cell directly inside a grid has none; the grid gap spaces it.
     */
    public double padding(IrContainerNode node) {
        if (node.isCell() && parentTypes.get(node.id()) == ContainerType.GRID) return 0;
        return spacing(node.style().padding());
    }

    /**
     * Resolves a spacing token with the project spacing as fallback, scaled by density.
     */
    public double spacing(String token) {
        return SpacingResolver.resolve(token, style.spacing(), style.density(), true);
    }

    public Optional<IrNode> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Optional<LayoutBox> box(String nodeId) {
        return Optional.ofNullable(positions.get(nodeId));
    }

    public IntrinsicSizer sizer() {
        return sizer;
    }

    public HeightEstimator estimator() {
        return estimator;
    }

    public LayoutOptions options() {
        return options;
    }

    PositionMap toPositionMap() {
        return new PositionMap(positions);
    }
}
