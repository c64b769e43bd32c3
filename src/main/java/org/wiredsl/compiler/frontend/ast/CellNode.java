package org.wiredsl.compiler.frontend.ast;

import org.wiredsl.compiler.util.OrderedMaps;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A grid cell. Its props (span, align, ...) are kept verbatim on the lowered container.
 *
 * @param props    Cell properties in declaration order.
 * @param children Layouts and components inside the cell; cells cannot nest directly.
 * @param nodeId   Optional source-map id.
 */
public record CellNode(Map<String, PropertyValue> props, List<AstNode> children, Optional<String> nodeId)
        implements AstNode {

    public CellNode {
        props = OrderedMaps.copyOf(props);
        children = children != null ? List.copyOf(children) : List.of();
        nodeId = nodeId != null ? nodeId : Optional.empty();
        for (AstNode child : children) {
            if (child instanceof CellNode) {
                throw new IllegalArgumentException("A cell cannot directly contain another cell");
            }
        }
    }

    public CellNode(Map<String, PropertyValue> props, List<AstNode> children) {
        this(props, children, Optional.empty());
    }
}
