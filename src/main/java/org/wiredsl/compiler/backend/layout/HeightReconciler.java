package org.wiredsl.compiler.backend.layout;

import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.IrNode;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.List;
import java.util.Optional;

/**
 * Second pass over a vertical run of children.
 * <p>
 * Heights estimated before placement can change once a child container sizes itself to its content.
 * This pass re-derives the running y from the stored heights and moves each shifted child together
 * with all of its descendants.
 */
public final class HeightReconciler {

    private HeightReconciler() {}

    /**
     * @param children The children in placement order.
     * @param startY   The y of the first child.
     * @param gap      The gap between consecutive children.
     * @param ctx      The layout context holding the boxes.
     */
    public static void reconcile(List<NodeRef> children, double startY, double gap, LayoutContext ctx) {
        double adjustedY = startY;
        for (int i = 0; i < children.size(); i++) {
            String ref = children.get(i).ref();
            Optional<LayoutBox> box = ctx.box(ref);
            if (box.isEmpty()) continue;
            LayoutBox childBox = box.get();
            double delta = adjustedY - childBox.getY();
            childBox.setY(adjustedY);
            if (delta != 0) {
                shiftDescendants(ref, delta, ctx);
            }
            adjustedY += childBox.getHeight();
            if (i < children.size() - 1) {
                adjustedY += gap;
            }
        }
    }

    static void shiftDescendants(String nodeId, double delta, LayoutContext ctx) {
        Optional<IrNode> node = ctx.node(nodeId);
        if (node.isEmpty() || !(node.get() instanceof IrContainerNode container)) return;
        for (NodeRef child : container.children()) {
            ctx.box(child.ref()).ifPresent(box -> {
                box.setY(box.getY() + delta);
                shiftDescendants(child.ref(), delta, ctx);
            });
        }
    }
}
