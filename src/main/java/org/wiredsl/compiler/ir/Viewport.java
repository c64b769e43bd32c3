package org.wiredsl.compiler.ir;

/**
 * The initial viewport of a screen; the height is a minimum baseline.
 */
public record Viewport(int width, int height) {}
