package org.wiredsl.compiler.ir;

/**
 * A screen of the IR.
 *
 * @param id         Sanitized screen id.
 * @param name       Declared screen name.
 * @param viewport   Initial viewport.
 * @param background Optional background, may be null.
 * @param root       Reference to the root container.
 */
public record IrScreen(String id, String name, Viewport viewport, String background, NodeRef root) {}
