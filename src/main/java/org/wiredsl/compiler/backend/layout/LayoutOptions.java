package org.wiredsl.compiler.backend.layout;

/**
 * Tunable constants of the layout pass.
 *
 * @param splitSidebarWidth   Width of the fixed split panel when the split names none.
 * @param imageFallbackHeight Height of an image laid out without any available width.
 */
public record LayoutOptions(double splitSidebarWidth, double imageFallbackHeight) {

    public static LayoutOptions defaults() {
        return new LayoutOptions(260, 200);
    }
}
