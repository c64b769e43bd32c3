package org.wiredsl.compiler.backend.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.wiredsl.compiler.ir.IrComponentNode;
import org.wiredsl.compiler.ir.IrMeta;
import org.wiredsl.compiler.ir.IrNodeStyle;
import org.wiredsl.compiler.ir.IrValue;
import org.wiredsl.compiler.style.DensityLevel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class IntrinsicSizerTest {

    private final IntrinsicSizer sizer = new IntrinsicSizer(DensityLevel.NORMAL, LayoutOptions.defaults());

    private static IrComponentNode node(String type, Object... keysAndValues) {
        Map<String, IrValue> props = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Object value = keysAndValues[i + 1];
            props.put((String) keysAndValues[i], value instanceof Number n ? IrValue.of(n.doubleValue()) : IrValue.of((String) value));
        }
        return new IrComponentNode("node_1", type, props, IrNodeStyle.empty(), new IrMeta(null, null));
    }

    @Test
    @DisplayName("Images derive their height from the aspect ratio of the placeholder")
    void height_image() {
        assertThat(sizer.height(node("Image"), 320)).isCloseTo(180, within(1e-6));
        assertThat(sizer.height(node("Image", "placeholder", "square"), 200)).isEqualTo(200);
        assertThat(sizer.height(node("Image", "placeholder", "portrait"), 200)).isCloseTo(300, within(1e-6));
        assertThat(sizer.height(node("Image", "height", 50), 320)).isEqualTo(50);
        assertThat(sizer.height(node("Image"), 0)).isEqualTo(200);
    }

    @Test
    void height_table() {
        assertThat(sizer.height(node("Table"), 600)).isEqualTo(224);
        assertThat(sizer.height(node("Table", "title", "Users", "rows", 3), 600)).isEqualTo(184);
        assertThat(sizer.height(node("Table", "pagination", "true"), 600)).isEqualTo(288);
    }

    @Test
    @DisplayName("Text wraps at the available width")
    void height_wrappedText() {
        assertThat(sizer.height(node("Text", "text", "aaaa bbbb cccc dddd"), 100)).isEqualTo(42);
        assertThat(sizer.height(node("Text", "text", "short"), 600)).isEqualTo(40);
        assertThat(sizer.height(node("Paragraph", "content", "aaaa bbbb cccc dddd"), 100)).isEqualTo(42);
    }

    @Test
    void height_alertAndMenus() {
        assertThat(sizer.height(node("Alert"), 280)).isEqualTo(43);
        assertThat(sizer.height(node("SidebarMenu", "items", "A, B, C, D"), 260)).isEqualTo(160);
        assertThat(sizer.height(node("SidebarMenu"), 260)).isEqualTo(120);
    }

    @Test
    void height_fixedComponents() {
        assertThat(sizer.height(node("Topbar", "title", "App"), 1280)).isEqualTo(56);
        assertThat(sizer.height(node("Divider"), 1280)).isEqualTo(1);
        assertThat(sizer.height(node("Chart", "type", "bar"), 1280)).isEqualTo(250);
        assertThat(sizer.height(node("Separate", "size", "lg"), 1280)).isEqualTo(24);
        assertThat(sizer.height(node("Separate", "size", 10), 1280)).isEqualTo(10);
        assertThat(sizer.height(node("Input"), 1280)).isEqualTo(40);
    }

    @Test
    void height_defaultFollowsDensity() {
        IntrinsicSizer compact = new IntrinsicSizer(DensityLevel.COMPACT, LayoutOptions.defaults());

        assertThat(compact.height(node("Select"), 200)).isEqualTo(32);
        assertThat(compact.height(node("Separate"), 200)).isEqualTo(13);
    }

    @Test
    void width_naturalSizes() {
        assertThat(sizer.width(node("Icon", "icon", "home"))).isEqualTo(18);
        assertThat(sizer.width(node("IconButton", "icon", "x", "size", "lg"))).isEqualTo(48);
        assertThat(sizer.width(node("Checkbox", "label", "Remember"))).isEqualTo(24);
        assertThat(sizer.width(node("Button", "text", "Save"))).isEqualTo(80);
        assertThat(sizer.width(node("Heading", "text", "Dashboard"))).isEqualTo(124);
        assertThat(sizer.width(node("Image", "placeholder", "avatar"))).isEqualTo(64);
        assertThat(sizer.width(node("Unknown"))).isEqualTo(120);
    }

    @Test
    void wrap_hardSplitsLongWords() {
        List<String> lines = TextWrapper.wrap("abcdefghijklmnop", 45, 14);

        assertThat(lines).containsExactly("abcde", "fghij", "klmno", "p");
    }

    @Test
    void wrap_keepsBlankLines() {
        assertThat(TextWrapper.wrap("one\n\ntwo", 500, 14)).containsExactly("one", "", "two");
        assertThat(TextWrapper.wrap("", 500, 14)).containsExactly("");
    }
}
