package org.wiredsl.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static metadata about built-in components and layouts: which component types exist and which
 * properties or parameters are required when bound from a macro argument.
 */
public final class BuiltinCatalog {

    private static final Set<String> BUILTIN_COMPONENTS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            "Button", "Input", "Heading", "Text", "Label", "Paragraph", "Image", "Card", "Stat", "StatCard",
            "Topbar", "Table", "Chart", "ChartPlaceholder", "Textarea", "Select", "Checkbox", "Toggle", "Divider",
            "Breadcrumbs", "SidebarMenu", "Radio", "Icon", "IconButton", "Alert", "Badge", "Modal", "List",
            "Sidebar", "Tabs", "Code", "Link", "Separate")));

    private static final Map<String, Set<String>> REQUIRED_COMPONENT_PROPS = new LinkedHashMap<>();
    private static final Map<String, Set<String>> REQUIRED_LAYOUT_PARAMS = new LinkedHashMap<>();

    static {
        for (String type : List.of("Heading", "Text", "Label", "Paragraph", "Button", "Link", "Badge")) {
            REQUIRED_COMPONENT_PROPS.put(type, Set.of("text"));
        }
        for (String type : List.of("Checkbox", "Radio", "Toggle")) {
            REQUIRED_COMPONENT_PROPS.put(type, Set.of("label"));
        }
        REQUIRED_COMPONENT_PROPS.put("Topbar", Set.of("title"));
        REQUIRED_COMPONENT_PROPS.put("Modal", Set.of("title"));
        for (String type : List.of("SidebarMenu", "Sidebar", "Breadcrumbs", "Tabs")) {
            REQUIRED_COMPONENT_PROPS.put(type, Set.of("items"));
        }
        REQUIRED_COMPONENT_PROPS.put("Table", Set.of("columns"));
        REQUIRED_COMPONENT_PROPS.put("Stat", Set.of("title", "value"));
        REQUIRED_COMPONENT_PROPS.put("Chart", Set.of("type"));
        REQUIRED_COMPONENT_PROPS.put("Code", Set.of("code"));
        REQUIRED_COMPONENT_PROPS.put("Icon", Set.of("icon"));
        REQUIRED_COMPONENT_PROPS.put("IconButton", Set.of("icon"));

        REQUIRED_LAYOUT_PARAMS.put("stack", Set.of("direction"));
        REQUIRED_LAYOUT_PARAMS.put("grid", Set.of("columns"));
    }

    private BuiltinCatalog() {}

    /**
     * @param componentType A component type name.
     * @return {@code true} if the renderer knows this component natively.
     */
    public static boolean isBuiltinComponent(String componentType) {
        return BUILTIN_COMPONENTS.contains(componentType);
    }

    /**
     * @return All built-in component names in catalog order.
     */
    public static Set<String> builtinComponents() {
        return BUILTIN_COMPONENTS;
    }

    /**
     * @param componentType The component type.
     * @param property      The property name.
     * @return {@code true} if the property is required and has no default.
     */
    public static boolean isRequiredComponentProp(String componentType, String property) {
        return REQUIRED_COMPONENT_PROPS.getOrDefault(componentType, Set.of()).contains(property);
    }

    /**
     * @param layoutType The built-in container type.
     * @param param      The parameter name.
     * @return {@code true} if the parameter is required and has no default.
     */
    public static boolean isRequiredLayoutParam(String layoutType, String param) {
        return REQUIRED_LAYOUT_PARAMS.getOrDefault(layoutType, Set.of()).contains(param);
    }
}
