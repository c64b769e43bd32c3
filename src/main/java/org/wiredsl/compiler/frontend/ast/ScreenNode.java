package org.wiredsl.compiler.frontend.ast;

import org.wiredsl.compiler.util.OrderedMaps;

import java.util.Map;
import java.util.Optional;

/**
 * A screen with exactly one root layout.
 */
public record ScreenNode(String name, Map<String, PropertyValue> params, LayoutNode layout, Optional<String> nodeId) {

    public ScreenNode {
        if (layout == null) throw new IllegalArgumentException("Screen '" + name + "' has no root layout");
        params = OrderedMaps.copyOf(params);
        nodeId = nodeId != null ? nodeId : Optional.empty();
    }

    public ScreenNode(String name, Map<String, PropertyValue> params, LayoutNode layout) {
        this(name, params, layout, Optional.empty());
    }
}
