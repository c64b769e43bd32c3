package org.wiredsl.compiler.frontend.ast;

import java.util.Optional;

/**
 * A {@code define Layout "name" { ... }} declaration whose body may contain one {@code Children} slot.
 */
public record DefinedLayoutNode(String name, LayoutNode body, Optional<String> nodeId) {

    public DefinedLayoutNode {
        nodeId = nodeId != null ? nodeId : Optional.empty();
    }

    public DefinedLayoutNode(String name, LayoutNode body) {
        this(name, body, Optional.empty());
    }
}
