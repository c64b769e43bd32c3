package org.wiredsl.compiler.frontend.ast;

import org.wiredsl.compiler.util.OrderedMaps;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A layout usage, either a built-in container (stack, grid, ...) or a defined layout.
 *
 * @param layoutType The container type or defined layout name.
 * @param params     Layout parameters in declaration order.
 * @param children   Child nodes in declaration order.
 * @param nodeId     Optional source-map id.
 */
public record LayoutNode(String layoutType, Map<String, PropertyValue> params, List<AstNode> children,
                         Optional<String> nodeId) implements AstNode {

    public LayoutNode {
        params = OrderedMaps.copyOf(params);
        children = children != null ? List.copyOf(children) : List.of();
        nodeId = nodeId != null ? nodeId : Optional.empty();
    }

    public LayoutNode(String layoutType, Map<String, PropertyValue> params, List<AstNode> children) {
        this(layoutType, params, children, Optional.empty());
    }
}
