package org.wiredsl.compiler.ir;

/**
 * A reference to a node in the project's node map.
 * @param ref The referenced node id.
 */
public record NodeRef(String ref) {}
