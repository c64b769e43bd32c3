package org.wiredsl.compiler.style;

import java.util.EnumMap;
import java.util.Map;

/**
 * Density-dependent size tables for icons, icon buttons and generic controls.
 */
public final class ComponentSizes {

    private static final Map<DensityLevel, Map<String, Integer>> ICON_SIZES = new EnumMap<>(DensityLevel.class);
    private static final Map<DensityLevel, Map<String, Integer>> ICON_BUTTON_SIZES = new EnumMap<>(DensityLevel.class);
    private static final Map<DensityLevel, Map<String, Integer>> CONTROL_HEIGHTS = new EnumMap<>(DensityLevel.class);
    private static final Map<DensityLevel, Map<String, Integer>> CONTROL_PADDING = new EnumMap<>(DensityLevel.class);

    static {
        ICON_SIZES.put(DensityLevel.COMPACT, Map.of("xs", 10, "sm", 12, "md", 16, "lg", 20, "xl", 28));
        ICON_SIZES.put(DensityLevel.NORMAL, Map.of("xs", 12, "sm", 14, "md", 18, "lg", 24, "xl", 32));
        ICON_SIZES.put(DensityLevel.COMFORTABLE, Map.of("xs", 14, "sm", 16, "md", 20, "lg", 28, "xl", 36));

        ICON_BUTTON_SIZES.put(DensityLevel.COMPACT, Map.of("sm", 28, "md", 32, "lg", 36));
        ICON_BUTTON_SIZES.put(DensityLevel.NORMAL, Map.of("sm", 36, "md", 40, "lg", 48));
        ICON_BUTTON_SIZES.put(DensityLevel.COMFORTABLE, Map.of("sm", 40, "md", 48, "lg", 56));

        CONTROL_HEIGHTS.put(DensityLevel.COMPACT, Map.of("sm", 28, "md", 32, "lg", 36));
        CONTROL_HEIGHTS.put(DensityLevel.NORMAL, Map.of("sm", 36, "md", 40, "lg", 48));
        CONTROL_HEIGHTS.put(DensityLevel.COMFORTABLE, Map.of("sm", 40, "md", 48, "lg", 56));

        CONTROL_PADDING.put(DensityLevel.COMPACT, Map.of("none", 0, "xs", 4, "sm", 8, "md", 10, "lg", 14, "xl", 18));
        CONTROL_PADDING.put(DensityLevel.NORMAL, Map.of("none", 0, "xs", 6, "sm", 10, "md", 14, "lg", 18, "xl", 24));
        CONTROL_PADDING.put(DensityLevel.COMFORTABLE, Map.of("none", 0, "xs", 8, "sm", 12, "md", 16, "lg", 22, "xl", 28));
    }

    private ComponentSizes() {}

    public static int iconSize(String size, DensityLevel density) {
        return lookup(ICON_SIZES, size, density);
    }

    public static int iconButtonSize(String size, DensityLevel density) {
        return lookup(ICON_BUTTON_SIZES, size, density);
    }

    public static int controlHeight(String size, DensityLevel density) {
        return lookup(CONTROL_HEIGHTS, size, density);
    }

    public static int controlHorizontalPadding(String padding, DensityLevel density) {
        return lookup(CONTROL_PADDING, padding, density);
    }

    // Unknown sizes fall back to "md" of the same density.
    private static int lookup(Map<DensityLevel, Map<String, Integer>> table, String size, DensityLevel density) {
        Map<String, Integer> sizes = table.get(density != null ? density : DensityLevel.NORMAL);
        Integer value = size != null ? sizes.get(size) : null;
        return value != null ? value : sizes.get("md");
    }
}
