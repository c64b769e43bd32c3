package org.wiredsl.compiler.backend.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of the layout pass: node id to absolute box, in placement order.
 */
public final class PositionMap {

    private final Map<String, LayoutBox> boxes;

    PositionMap(Map<String, LayoutBox> boxes) {
        this.boxes = Collections.unmodifiableMap(new LinkedHashMap<>(boxes));
    }

    /**
     * @param nodeId A node id.
     * @return The box of the node, or empty if the node was not laid out.
     */
    public Optional<LayoutBox> get(String nodeId) {
        return Optional.ofNullable(boxes.get(nodeId));
    }

    /**
     * @param nodeId A node id.
     * @return The box of the node.
     * @throws IllegalArgumentException if the node was not laid out.
     */
    public LayoutBox require(String nodeId) {
        LayoutBox box = boxes.get(nodeId);
        if (box == null) throw new IllegalArgumentException("No layout box for node '" + nodeId + "'");
        return box;
    }

    public boolean contains(String nodeId) {
        return boxes.containsKey(nodeId);
    }

    public int size() {
        return boxes.size();
    }

    public Map<String, LayoutBox> asMap() {
        return boxes;
    }
}
