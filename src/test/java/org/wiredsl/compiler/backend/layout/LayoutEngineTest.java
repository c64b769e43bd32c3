package org.wiredsl.compiler.backend.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.wiredsl.compiler.api.CompilationException;
import org.wiredsl.compiler.frontend.ast.AstNode;
import org.wiredsl.compiler.frontend.ast.LayoutNode;
import org.wiredsl.compiler.frontend.ast.ProjectNode;
import org.wiredsl.compiler.frontend.ast.PropertyValue;
import org.wiredsl.compiler.frontend.irgen.IrGenerator;
import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.IrContract;
import org.wiredsl.compiler.ir.IrMeta;
import org.wiredsl.compiler.ir.IrNode;
import org.wiredsl.compiler.ir.IrNodeStyle;
import org.wiredsl.compiler.ir.IrProject;
import org.wiredsl.compiler.ir.IrScreen;
import org.wiredsl.compiler.ir.IrStyle;
import org.wiredsl.compiler.ir.NodeRef;
import org.wiredsl.compiler.ir.Viewport;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.wiredsl.compiler.AstFixtures.cell;
import static org.wiredsl.compiler.AstFixtures.component;
import static org.wiredsl.compiler.AstFixtures.layout;
import static org.wiredsl.compiler.AstFixtures.project;
import static org.wiredsl.compiler.AstFixtures.props;
import static org.wiredsl.compiler.AstFixtures.singleScreen;
import static org.wiredsl.compiler.AstFixtures.vstack;

/**
 * Tests for the layout pass. All expectations use normal density (spacing md = 16, control height 40)
 * on the 1280 px desktop viewport unless stated otherwise.
 */
@Tag("unit")
public class LayoutEngineTest {

    private static PositionMap layoutOf(ProjectNode project) throws CompilationException {
        return new LayoutEngine().calculate(new IrGenerator().generate(project));
    }

    private static PositionMap layoutOf(LayoutNode root) throws CompilationException {
        return layoutOf(singleScreen(root));
    }

    private static void assertBox(LayoutBox box, double x, double y, double width, double height) {
        assertThat(box.getX()).as("x").isCloseTo(x, within(0.001));
        assertThat(box.getY()).as("y").isCloseTo(y, within(0.001));
        assertThat(box.getWidth()).as("width").isCloseTo(width, within(0.001));
        assertThat(box.getHeight()).as("height").isCloseTo(height, within(0.001));
    }

    private static LayoutNode horizontal(Map<String, PropertyValue> params, AstNode... children) {
        return layout("stack", params, children);
    }

    @Nested
    class VerticalStack {

        @Test
        @DisplayName("Children are placed top-down inside the padding, separated by the gap")
        void stack_spacingLaw() throws CompilationException {
            PositionMap positions = layoutOf(layout("stack", props("direction", "vertical", "gap", "md", "padding", "lg"),
                    component("Button", "text", "A"),
                    component("Button", "text", "B"),
                    component("Input")));

            assertBox(positions.require("node_2"), 24, 24, 1232, 40);
            assertBox(positions.require("node_3"), 24, 80, 1232, 40);
            assertBox(positions.require("node_4"), 24, 136, 1232, 40);
            // content bottom 176 plus bottom padding
            assertBox(positions.require("node_1"), 0, 0, 1280, 200);
        }

        @Test
        void stack_missingGapUsesProjectSpacing() throws CompilationException {
            PositionMap positions = layoutOf(vstack(component("Button", "text", "A"), component("Button", "text", "B")));

            assertThat(positions.require("node_3").getY()).isEqualTo(56);
        }

        @Test
        void stack_nestedStackSizesToContent() throws CompilationException {
            PositionMap positions = layoutOf(vstack(
                    layout("stack", props("direction", "vertical", "padding", "sm", "gap", "sm"),
                            component("Button", "text", "A"), component("Button", "text", "B")),
                    component("Button", "text", "C")));

            assertBox(positions.require("node_2"), 0, 0, 1280, 104);
            assertBox(positions.require("node_3"), 8, 8, 1264, 40);
            assertBox(positions.require("node_4"), 8, 56, 1264, 40);
            assertThat(positions.require("node_5").getY()).isEqualTo(120);
        }

        @Test
        void stack_explicitComponentSize() throws CompilationException {
            PositionMap positions = layoutOf(vstack(component("Button", "text", "A", "width", 200, "height", 60)));

            assertBox(positions.require("node_2"), 0, 0, 200, 60);
        }

        @Test
        @DisplayName("Spacing and control heights grow with density")
        void stack_densityMonotonicity() throws CompilationException {
            double[] heights = new double[3];
            String[] densities = {"compact", "normal", "comfortable"};
            for (int i = 0; i < densities.length; i++) {
                ProjectNode source = project("P").style("density", densities[i])
                        .screen("Main", layout("stack", props("direction", "vertical", "gap", "md", "padding", "md"),
                                component("Button", "text", "A"),
                                component("Button", "text", "B"),
                                component("Button", "text", "C")))
                        .build();
                heights[i] = layoutOf(source).require("node_1").getHeight();
            }

            assertThat(heights).containsExactly(148, 184, 224);
        }
    }

    @Nested
    class HorizontalStack {

        private final AstNode save = component("Button", "text", "Save");
        private final AstNode cancel = component("Button", "text", "Cancel now");

        @Test
        @DisplayName("Without align or justify the row is shared equally")
        void row_equalWidthsByDefault() throws CompilationException {
            PositionMap positions = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm"), save, cancel));

            assertBox(positions.require("node_2"), 0, 0, 636, 40);
            assertBox(positions.require("node_3"), 644, 0, 636, 40);
        }

        @Test
        void row_alignLeftUsesNaturalWidths() throws CompilationException {
            PositionMap positions = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "align", "left"), save, cancel));

            assertBox(positions.require("node_2"), 0, 0, 80, 40);
            assertBox(positions.require("node_3"), 88, 0, 112, 40);
        }

        @Test
        void row_alignRightAndCenter() throws CompilationException {
            PositionMap right = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "align", "right"), save, cancel));
            PositionMap center = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "align", "center"), save, cancel));

            assertThat(right.require("node_2").getX()).isEqualTo(1080);
            assertThat(right.require("node_3").right()).isEqualTo(1280);
            assertThat(center.require("node_2").getX()).isEqualTo(540);
        }

        @Test
        @DisplayName("Without a justify mode, start and end behave like left and right")
        void row_alignStartAndEnd() throws CompilationException {
            PositionMap end = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "align", "end"), save, cancel));
            PositionMap start = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "align", "start"), save, cancel));

            assertThat(end.require("node_2").getX()).isEqualTo(1080);
            assertThat(end.require("node_3").right()).isEqualTo(1280);
            assertBox(start.require("node_2"), 0, 0, 80, 40);
            assertBox(start.require("node_3"), 88, 0, 112, 40);
        }

        @Test
        @DisplayName("spaceBetween pins the first and last child to the edges")
        void row_spaceBetween() throws CompilationException {
            PositionMap positions = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "justify", "spaceBetween"),
                    component("Button", "text", "A"), component("Button", "text", "B"), component("Button", "text", "C")));

            assertThat(positions.require("node_2").getX()).isEqualTo(0);
            assertThat(positions.require("node_3").getX()).isEqualTo(600);
            assertThat(positions.require("node_4").right()).isEqualTo(1280);
        }

        @Test
        void row_justifyEndAndCenter() throws CompilationException {
            PositionMap end = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "justify", "end"),
                    component("Button", "text", "A"), component("Button", "text", "B"), component("Button", "text", "C")));
            PositionMap center = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "justify", "center"),
                    component("Button", "text", "A"), component("Button", "text", "B"), component("Button", "text", "C")));

            assertThat(end.require("node_2").getX()).isEqualTo(1024);
            assertThat(end.require("node_4").right()).isEqualTo(1280);
            assertThat(center.require("node_2").getX()).isEqualTo(512);
        }

        @Test
        void row_spaceAroundIsSymmetric() throws CompilationException {
            PositionMap positions = layoutOf(horizontal(props("direction", "horizontal", "gap", "sm", "justify", "spaceAround"),
                    component("Button", "text", "A"), component("Button", "text", "B"), component("Button", "text", "C")));

            double leftMargin = positions.require("node_2").getX();
            double rightMargin = 1280 - positions.require("node_4").right();
            assertThat(leftMargin).isGreaterThan(0).isCloseTo(rightMargin, within(0.001));
        }

        @Test
        void row_justifyStretchSharesWidth() throws CompilationException {
            PositionMap positions = layoutOf(horizontal(props("direction", "horizontal", "gap", "md", "justify", "stretch"),
                    component("Button", "text", "A"), component("Button", "text", "B")));

            assertBox(positions.require("node_2"), 0, 0, 632, 40);
            assertBox(positions.require("node_3"), 648, 0, 632, 40);
        }

        @Test
        @DisplayName("With a justify mode, align positions children on the cross axis")
        void row_crossAxisAlign() throws CompilationException {
            PositionMap positions = layoutOf(horizontal(props("direction", "horizontal", "justify", "start", "align", "center"),
                    component("Button", "text", "A"), component("Textarea")));

            assertBox(positions.require("node_2"), 0, 30, 80, 40);
            assertBox(positions.require("node_3"), 96, 0, 200, 100);
        }
    }

    @Nested
    class Grid {

        @Test
        @DisplayName("Cells pack into rows by span and share the row height")
        void grid_packsBySpan() throws CompilationException {
            PositionMap positions = layoutOf(layout("grid", props("columns", 12, "gap", "md"),
                    cell(6, component("Button", "text", "A")),
                    cell(6, component("Button", "text", "B")),
                    cell(12, component("Button", "text", "C"))));

            assertBox(positions.require("node_2"), 0, 0, 632, 40);
            assertBox(positions.require("node_4"), 648, 0, 632, 40);
            assertBox(positions.require("node_6"), 0, 56, 1280, 40);
            assertBox(positions.require("node_5"), 648, 0, 632, 40);
        }

        @Test
        void grid_rowHeightIsTallestCell() throws CompilationException {
            PositionMap positions = layoutOf(layout("grid", props("columns", 2, "gap", "md"),
                    cell(1, component("Button", "text", "A")),
                    cell(1, component("Textarea")),
                    cell(1, component("Button", "text", "B"))));

            assertThat(positions.require("node_6").getY()).isEqualTo(116);
        }

        @Test
        void grid_spanIsClampedToColumns() throws CompilationException {
            PositionMap positions = layoutOf(layout("grid", props("columns", 4, "gap", "none"),
                    cell(9, component("Button", "text", "A"))));

            assertThat(positions.require("node_2").getWidth()).isEqualTo(1280);
        }
    }

    @Nested
    class Containers {

        @Test
        @DisplayName("A card sizes to content plus gaps plus its padding on both sides")
        void card_autoSize() throws CompilationException {
            PositionMap positions = layoutOf(vstack(
                    layout("card", props("padding", "md", "gap", "sm"),
                            component("Heading", "text", "Title"),
                            component("Text", "text", "Body")),
                    component("Button", "text", "Next")));

            assertBox(positions.require("node_2"), 0, 0, 1280, 120);
            assertBox(positions.require("node_3"), 16, 16, 1248, 40);
            assertBox(positions.require("node_4"), 16, 64, 1248, 40);
            assertThat(positions.require("node_5").getY()).isEqualTo(136);
            assertThat(positions.require("node_1").getHeight()).isEqualTo(176);
        }

        @Test
        void split_leftWidth() throws CompilationException {
            PositionMap positions = layoutOf(layout("split", props("left", 300, "gap", "md"),
                    vstack(component("SidebarMenu", "items", "Home,Users")),
                    vstack(component("Button", "text", "Go"))));

            assertBox(positions.require("node_2"), 0, 0, 300, 80);
            assertThat(positions.require("node_4").getX()).isEqualTo(316);
            assertThat(positions.require("node_4").getWidth()).isEqualTo(964);
        }

        @Test
        void split_defaultSidebarWidth() throws CompilationException {
            PositionMap positions = layoutOf(layout("split", props("gap", "md"),
                    vstack(component("Button", "text", "A")),
                    vstack(component("Button", "text", "B"))));

            assertThat(positions.require("node_2").getWidth()).isEqualTo(260);
            assertThat(positions.require("node_4").getX()).isEqualTo(276);
            assertThat(positions.require("node_4").getWidth()).isEqualTo(1004);
        }

        @Test
        void split_rightWidth() throws CompilationException {
            PositionMap positions = layoutOf(layout("split", props("right", 320, "gap", "md"),
                    vstack(component("Button", "text", "A")),
                    vstack(component("Button", "text", "B"))));

            assertThat(positions.require("node_2").getWidth()).isEqualTo(944);
            assertThat(positions.require("node_4").getX()).isEqualTo(960);
            assertThat(positions.require("node_4").getWidth()).isEqualTo(320);
        }

        @Test
        void split_configuredSidebarWidth() throws CompilationException {
            IrContract contract = new IrGenerator().generate(singleScreen(layout("split", props("gap", "none"),
                    vstack(component("Button", "text", "A")),
                    vstack(component("Button", "text", "B")))));

            PositionMap positions = new LayoutEngine(new LayoutOptions(200, 200)).calculate(contract);

            assertThat(positions.require("node_4").getX()).isEqualTo(200);
        }

        @Test
        void panel_insetsItsChild() throws CompilationException {
            PositionMap positions = layoutOf(layout("panel", props("padding", "md"), component("Button", "text", "A")));

            assertBox(positions.require("node_2"), 16, 16, 1248, 40);
        }

        @Test
        @DisplayName("Children a panel or split cannot place get empty boxes")
        void surplusChildren_getEmptyBoxes() throws CompilationException {
            PositionMap panel = layoutOf(layout("panel", props("padding", "md"),
                    component("Button", "text", "A"), component("Button", "text", "B")));
            PositionMap split = layoutOf(layout("split", props("gap", "md"),
                    component("Button", "text", "A"), component("Button", "text", "B"),
                    vstack(component("Button", "text", "C"))));

            assertThat(panel.size()).isEqualTo(3);
            assertBox(panel.require("node_3"), 16, 16, 0, 0);
            assertThat(split.size()).isEqualTo(5);
            assertBox(split.require("node_4"), 0, 0, 0, 0);
            assertThat(split.contains("node_5")).isTrue();
        }
    }

    @Nested
    class Engine {

        @Test
        void calculate_laysOutEveryScreen() throws CompilationException {
            PositionMap positions = layoutOf(project("P")
                    .style("device", "mobile")
                    .screen("A", vstack(component("Button", "text", "A")))
                    .screen("B", vstack(component("Button", "text", "B")))
                    .build());

            assertThat(positions.size()).isEqualTo(4);
            assertThat(positions.require("node_1").getWidth()).isEqualTo(375);
            assertThat(positions.require("node_3").getWidth()).isEqualTo(375);
        }

        @Test
        void calculate_skipsMissingReferences() {
            IrContainerNode root = new IrContainerNode("node_1", ContainerType.STACK, Map.of(),
                    List.of(new NodeRef("node_9")), new IrNodeStyle("none", null, null, null, null), new IrMeta(null, null));
            Map<String, IrNode> nodes = Map.of("node_1", root);
            IrScreen screen = new IrScreen("main", "Main", new Viewport(800, 600), null, new NodeRef("node_1"));
            IrContract contract = new IrContract(new IrProject("p", "P", IrStyle.defaults(), Map.of(), Map.of(), List.of(screen), nodes));

            PositionMap positions = new LayoutEngine().calculate(contract);

            assertThat(positions.contains("node_1")).isTrue();
            assertThat(positions.contains("node_9")).isFalse();
            assertThat(positions.get("node_9")).isEmpty();
        }
    }
}
