package org.wiredsl.compiler.frontend.ast;

import org.wiredsl.compiler.util.OrderedMaps;

import java.util.List;
import java.util.Map;

/**
 * The root of a parsed wireframe project.
 *
 * @param name              The project name.
 * @param style             Raw style settings (density, spacing, device, ...).
 * @param colors            Named color tokens.
 * @param mocks             Mock data keyed by name.
 * @param definedComponents Component definitions in declaration order.
 * @param definedLayouts    Layout definitions in declaration order.
 * @param screens           Screens in declaration order.
 */
public record ProjectNode(String name,
                          Map<String, String> style,
                          Map<String, String> colors,
                          Map<String, String> mocks,
                          List<DefinedComponentNode> definedComponents,
                          List<DefinedLayoutNode> definedLayouts,
                          List<ScreenNode> screens) {

    public ProjectNode {
        name = name != null ? name : "";
        style = OrderedMaps.copyOf(style);
        colors = OrderedMaps.copyOf(colors);
        mocks = OrderedMaps.copyOf(mocks);
        definedComponents = definedComponents != null ? List.copyOf(definedComponents) : List.of();
        definedLayouts = definedLayouts != null ? List.copyOf(definedLayouts) : List.of();
        screens = screens != null ? List.copyOf(screens) : List.of();
    }
}
