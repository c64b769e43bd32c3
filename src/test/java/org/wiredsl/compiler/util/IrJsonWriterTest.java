package org.wiredsl.compiler.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.wiredsl.compiler.backend.layout.LayoutEngine;
import org.wiredsl.compiler.backend.layout.PositionMap;
import org.wiredsl.compiler.frontend.ast.ProjectNode;
import org.wiredsl.compiler.frontend.irgen.IrGenerator;
import org.wiredsl.compiler.ir.IrContract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.wiredsl.compiler.AstFixtures.bind;
import static org.wiredsl.compiler.AstFixtures.cell;
import static org.wiredsl.compiler.AstFixtures.component;
import static org.wiredsl.compiler.AstFixtures.layout;
import static org.wiredsl.compiler.AstFixtures.project;
import static org.wiredsl.compiler.AstFixtures.props;

@Tag("unit")
public class IrJsonWriterTest {

    private final IrJsonWriter writer = new IrJsonWriter();
    private IrContract contract;

    @BeforeEach
    void setUp() throws Exception {
        ProjectNode source = project("Shop")
                .style("density", "compact")
                .screen("Checkout", layout("grid", props("columns", 12, "gap", "sm"),
                        cell(6, component("Button", "text", "Pay", "width", 120.5)),
                        cell(6, component("Text", "text", bind("total")))))
                .build();
        contract = new IrGenerator().generate(source);
    }

    @Test
    void toJson_contractShape() {
        ObjectNode json = writer.toJson(contract);

        assertThat(json.get("irVersion").asText()).isEqualTo("1.0");
        assertThat(json.at("/project/id").asText()).isEqualTo("shop");
        assertThat(json.at("/project/style/density").asText()).isEqualTo("compact");
        assertThat(json.at("/project/style/spacing").asText()).isEqualTo("md");
        assertThat(json.at("/project/screens/0/viewport/width").asInt()).isEqualTo(1280);
        assertThat(json.at("/project/screens/0/root/ref").asText()).isEqualTo("node_1");
        assertThat(json.at("/project/screens/0").has("background")).isFalse();
    }

    @Test
    void toJson_nodes() {
        JsonNode nodes = writer.toJson(contract).at("/project/nodes");

        assertThat(nodes.fieldNames()).toIterable().containsExactly("node_1", "node_2", "node_3", "node_4", "node_5");
        assertThat(nodes.at("/node_1/kind").asText()).isEqualTo("container");
        assertThat(nodes.at("/node_1/containerType").asText()).isEqualTo("grid");
        assertThat(nodes.at("/node_1/params/columns").isIntegralNumber()).isTrue();
        assertThat(nodes.at("/node_1/style/gap").asText()).isEqualTo("sm");
        assertThat(nodes.at("/node_1/children/1/ref").asText()).isEqualTo("node_4");
        assertThat(nodes.at("/node_2/meta/source").asText()).isEqualTo("cell");
        assertThat(nodes.at("/node_3/kind").asText()).isEqualTo("component");
        assertThat(nodes.at("/node_3/props/width").asDouble()).isEqualTo(120.5);
        assertThat(nodes.at("/node_5/props/text").asText()).isEqualTo("prop_total");
        assertThat(nodes.get("node_3").get("style").size()).isZero();
        assertThat(nodes.get("node_3").get("meta").has("nodeId")).isFalse();
    }

    @Test
    void write_isDeterministic() throws Exception {
        IrContract again = new IrGenerator().generate(project("Shop")
                .style("density", "compact")
                .screen("Checkout", layout("grid", props("columns", 12, "gap", "sm"),
                        cell(6, component("Button", "text", "Pay", "width", 120.5)),
                        cell(6, component("Text", "text", bind("total")))))
                .build());

        assertThat(writer.write(again)).isEqualTo(writer.write(contract));
    }

    @Test
    void write_positions() throws Exception {
        PositionMap positions = new LayoutEngine().calculate(contract);

        JsonNode json = new ObjectMapper().readTree(writer.write(positions));

        assertThat(json.size()).isEqualTo(positions.size());
        assertThat(json.at("/node_1/x").asDouble()).isZero();
        assertThat(json.at("/node_1/width").asDouble()).isEqualTo(1280);
        assertThat(json.at("/node_3/width").asDouble()).isEqualTo(120.5);
    }
}
