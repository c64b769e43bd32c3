package org.wiredsl.compiler.backend.layout;

import org.wiredsl.compiler.ir.IrComponentNode;
import org.wiredsl.compiler.ir.IrValue;
import org.wiredsl.compiler.style.ComponentSizes;
import org.wiredsl.compiler.style.DensityLevel;
import org.wiredsl.compiler.style.SpacingResolver;
import org.wiredsl.compiler.style.TextMetrics;

import java.util.Arrays;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Heuristic natural sizes of components that carry no explicit width or height.
 */
public final class IntrinsicSizer {

    private static final Map<String, Double> IMAGE_RATIOS = Map.of(
            "landscape", 16.0 / 9.0,
            "portrait", 2.0 / 3.0,
            "square", 1.0,
            "icon", 1.0,
            "avatar", 1.0);

    private static final Map<String, Double> IMAGE_WIDTHS = Map.of(
            "landscape", 300.0,
            "portrait", 200.0,
            "square", 200.0,
            "icon", 64.0,
            "avatar", 64.0);

    private static final double DEFAULT_TEXT_WIDTH = 200;
    private static final double DEFAULT_ALERT_WIDTH = 280;
    private static final double DEFAULT_WIDTH = 120;

    private final DensityLevel density;
    private final LayoutOptions options;

    public IntrinsicSizer(DensityLevel density, LayoutOptions options) {
        this.density = density != null ? density : DensityLevel.NORMAL;
        this.options = options;
    }

    /**
     * @return The flat default height of a control at the current density.
     */
    public double defaultHeight() {
        return density.controlHeight();
    }

    /**
     * Estimates the height of a component laid out at the given width.
     *
     * @param node           The component.
     * @param availableWidth The width the component will occupy; non-positive if unknown.
     * @return The natural height in pixels.
     */
    public double height(IrComponentNode node, double availableWidth) {
        Map<String, IrValue> props = node.props();
        switch (node.componentType()) {
            case "Image":
                return imageHeight(props, availableWidth);
            case "Table":
                return tableHeight(props);
            case "Heading":
                return wrappedHeight(text(props, "Heading", "text"), availableWidth, TextMetrics.heading(density));
            case "Text":
            case "Paragraph":
                return wrappedHeight(text(props, "", "text", "content"), availableWidth, TextMetrics.body(density));
            case "Alert":
                return alertHeight(props, availableWidth);
            case "SidebarMenu":
                return sidebarMenuHeight(props);
            case "Textarea":
                return 100;
            case "Modal":
                return 300;
            case "Card":
            case "StatCard":
            case "Stat":
                return 120;
            case "ChartPlaceholder":
            case "Chart":
                return 250;
            case "List":
                return 180;
            case "Topbar":
                return 56;
            case "Divider":
                return 1;
            case "Separate":
                return separateSize(props);
            default:
                return defaultHeight();
        }
    }

    /**
     * Estimates the natural width of a component in a horizontal row.
     *
     * @param node The component.
     * @return The natural width in pixels.
     */
    public double width(IrComponentNode node) {
        Map<String, IrValue> props = node.props();
        switch (node.componentType()) {
            case "Icon":
                return ComponentSizes.iconSize(text(props, "md", "size"), density);
            case "IconButton":
                return ComponentSizes.iconButtonSize(text(props, "md", "size"), density);
            case "Checkbox":
            case "Radio":
                return 24;
            case "Separate":
                return separateSize(props);
            case "Button":
            case "Link":
                return Math.max(80, text(props, "", "text").length() * 8 + 32);
            case "Label":
            case "Text":
                return Math.max(60, text(props, "", "content", "text").length() * 8 + 16);
            case "Heading":
                return Math.max(80, text(props, "", "text").length() * 12 + 16);
            case "Input":
            case "Select":
            case "Textarea":
                return 200;
            case "Image":
                return IMAGE_WIDTHS.getOrDefault(text(props, "landscape", "placeholder"), 300.0);
            case "Table":
                return 400;
            case "StatCard":
            case "Card":
                return 280;
            case "SidebarMenu":
                return 260;
            case "Badge":
            case "Chip":
                return Math.max(50, text(props, "", "text").length() * 7 + 16);
            default:
                return DEFAULT_WIDTH;
        }
    }

    /**
     * @return The width assumed for containers and unknown nodes in a horizontal row.
     */
    public double defaultWidth() {
        return DEFAULT_WIDTH;
    }

    /**
     * @param props The props of a node.
     * @param key   The prop name.
     * @return The prop as a positive number, or empty.
     */
    public static OptionalDouble positive(Map<String, IrValue> props, String key) {
        IrValue value = props.get(key);
        if (value == null) return OptionalDouble.empty();
        OptionalDouble number = value.asNumber();
        return number.isPresent() && number.getAsDouble() > 0 ? number : OptionalDouble.empty();
    }

    private double imageHeight(Map<String, IrValue> props, double availableWidth) {
        OptionalDouble explicit = positive(props, "height");
        if (explicit.isPresent()) return explicit.getAsDouble();
        double ratio = IMAGE_RATIOS.getOrDefault(text(props, "landscape", "placeholder"), 16.0 / 9.0);
        if (availableWidth > 0) return availableWidth / ratio;
        return options.imageFallbackHeight();
    }

    private double tableHeight(Map<String, IrValue> props) {
        OptionalDouble explicit = positive(props, "height");
        if (explicit.isPresent()) return explicit.getAsDouble();
        IrValue rowsValue = props.get("rows");
        double rows = rowsValue != null ? rowsValue.asNumber().orElse(5) : 5;
        double title = props.containsKey("title") && !props.get("title").asText().isEmpty() ? 32 : 0;
        double pagination = props.containsKey("pagination") && "true".equals(props.get("pagination").asText()) ? 64 : 0;
        return title + 44 + rows * 36 + pagination;
    }

    private double wrappedHeight(String text, double availableWidth, TextMetrics metrics) {
        double maxWidth = availableWidth > 0 ? availableWidth : DEFAULT_TEXT_WIDTH;
        int lines = TextWrapper.wrap(text, maxWidth, metrics.fontSize()).size();
        return Math.max(defaultHeight(), Math.max(1, lines) * metrics.lineHeightPx());
    }

    private double alertHeight(Map<String, IrValue> props, double availableWidth) {
        int fontSize = 13;
        int titleLineHeight = (int) Math.ceil(fontSize * 1.25);
        int textLineHeight = (int) Math.ceil(fontSize * 1.4);
        double maxWidth = Math.max(40, (availableWidth > 0 ? availableWidth : DEFAULT_ALERT_WIDTH) - 24);

        String title = text(props, "", "title");
        int titleLines = title.isBlank() ? 0 : TextWrapper.wrap(title, maxWidth, fontSize).size();
        int textLines = TextWrapper.wrap(text(props, "Alert message", "text"), maxWidth, fontSize).size();
        double titleGap = titleLines > 0 ? 6 : 0;
        double height = 12 + titleLines * titleLineHeight + titleGap + Math.max(1, textLines) * textLineHeight + 12;
        return Math.max(defaultHeight(), height);
    }

    private double sidebarMenuHeight(Map<String, IrValue> props) {
        long items = Arrays.stream(text(props, "Item 1,Item 2,Item 3", "items").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .count();
        return Math.max(defaultHeight(), (items > 0 ? items : 3) * 40);
    }

    private double separateSize(Map<String, IrValue> props) {
        IrValue size = props.get("size");
        if (size instanceof IrValue.Num n) return n.value();
        String token = size != null ? size.asText() : "md";
        return SpacingResolver.resolve(token, "md", density, true);
    }

    // First non-empty prop among keys, else the fallback.
    private static String text(Map<String, IrValue> props, String fallback, String... keys) {
        for (String key : keys) {
            IrValue value = props.get(key);
            if (value != null && !value.asText().isEmpty()) return value.asText();
        }
        return fallback;
    }
}
