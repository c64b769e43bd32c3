package org.wiredsl.compiler.frontend.ast;

import org.wiredsl.compiler.util.OrderedMaps;

import java.util.Map;
import java.util.Optional;

/**
 * A component usage. Components are leaves of the syntax tree.
 *
 * @param componentType The built-in or defined component name.
 * @param props         Properties in declaration order.
 * @param nodeId        Optional source-map id.
 */
public record ComponentNode(String componentType, Map<String, PropertyValue> props, Optional<String> nodeId)
        implements AstNode {

    /** The placeholder component that marks the children slot of a defined layout. */
    public static final String CHILDREN_SLOT = "Children";

    public ComponentNode {
        props = OrderedMaps.copyOf(props);
        nodeId = nodeId != null ? nodeId : Optional.empty();
    }

    public ComponentNode(String componentType, Map<String, PropertyValue> props) {
        this(componentType, props, Optional.empty());
    }

    /**
     * @return {@code true} if this is the {@code Children} placeholder.
     */
    public boolean isChildrenSlot() {
        return CHILDREN_SLOT.equals(componentType);
    }
}
