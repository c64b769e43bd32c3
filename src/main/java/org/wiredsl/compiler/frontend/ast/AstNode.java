package org.wiredsl.compiler.frontend.ast;

import java.util.Optional;

/**
 * A node of the parsed wireframe syntax tree that can appear inside a screen or a definition body.
 */
public sealed interface AstNode permits LayoutNode, ComponentNode, CellNode {

    /**
     * @return The source-map id assigned by the parser, if any.
     */
    Optional<String> nodeId();
}
