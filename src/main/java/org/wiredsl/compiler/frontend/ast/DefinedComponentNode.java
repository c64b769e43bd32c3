package org.wiredsl.compiler.frontend.ast;

import java.util.Optional;

/**
 * A {@code define Component "Name" { ... }} declaration. Valid bodies are a layout or a component;
 * anything else is rejected during expansion.
 */
public record DefinedComponentNode(String name, AstNode body, Optional<String> nodeId) {

    public DefinedComponentNode {
        nodeId = nodeId != null ? nodeId : Optional.empty();
    }

    public DefinedComponentNode(String name, AstNode body) {
        this(name, body, Optional.empty());
    }
}
