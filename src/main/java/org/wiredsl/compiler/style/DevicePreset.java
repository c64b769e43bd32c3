package org.wiredsl.compiler.style;

/**
 * A named viewport baseline. The minimum height is the initial viewport height;
 * rendered output may grow beyond it with content.
 *
 * @param name        Human readable preset name.
 * @param width       Viewport width in pixels.
 * @param minHeight   Baseline viewport height in pixels.
 * @param category    Device category (mobile, tablet, desktop, print).
 * @param description Short description of the preset.
 */
public record DevicePreset(String name, int width, int minHeight, String category, String description) {}
