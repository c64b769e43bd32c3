package org.wiredsl.compiler.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.wiredsl.compiler.backend.layout.LayoutBox;
import org.wiredsl.compiler.backend.layout.PositionMap;
import org.wiredsl.compiler.ir.IrComponentNode;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.IrContract;
import org.wiredsl.compiler.ir.IrMeta;
import org.wiredsl.compiler.ir.IrNode;
import org.wiredsl.compiler.ir.IrNodeStyle;
import org.wiredsl.compiler.ir.IrProject;
import org.wiredsl.compiler.ir.IrScreen;
import org.wiredsl.compiler.ir.IrStyle;
import org.wiredsl.compiler.ir.IrValue;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.Map;

/**
 * Serializes IR contracts and position maps to JSON for the renderer.
 * <p>
 * Keys are written in a fixed order and maps in insertion order, so equal inputs produce
 * byte-identical output. Absent optional fields are omitted.
 */
public final class IrJsonWriter {

    private final ObjectMapper mapper;

    public IrJsonWriter() {
        this(new ObjectMapper());
    }

    public IrJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param contract The contract.
     * @return The contract as a pretty-printed JSON document.
     */
    public String write(IrContract contract) {
        return serialize(toJson(contract));
    }

    /**
     * @param positions The layout result.
     * @return The position map as a pretty-printed JSON document.
     */
    public String write(PositionMap positions) {
        return serialize(toJson(positions));
    }

    public ObjectNode toJson(IrContract contract) {
        ObjectNode root = mapper.createObjectNode();
        root.put("irVersion", contract.irVersion());
        IrProject project = contract.project();
        ObjectNode p = root.putObject("project");
        p.put("id", project.id());
        p.put("name", project.name());
        p.set("style", style(project.style()));
        p.set("mocks", strings(project.mocks()));
        p.set("colors", strings(project.colors()));
        ArrayNode screens = p.putArray("screens");
        for (IrScreen screen : project.screens()) {
            ObjectNode s = screens.addObject();
            s.put("id", screen.id());
            s.put("name", screen.name());
            ObjectNode viewport = s.putObject("viewport");
            viewport.put("width", screen.viewport().width());
            viewport.put("height", screen.viewport().height());
            putIfPresent(s, "background", screen.background());
            s.putObject("root").put("ref", screen.root().ref());
        }
        ObjectNode nodes = p.putObject("nodes");
        for (Map.Entry<String, IrNode> entry : project.nodes().entrySet()) {
            nodes.set(entry.getKey(), node(entry.getValue()));
        }
        return root;
    }

    public ObjectNode toJson(PositionMap positions) {
        ObjectNode root = mapper.createObjectNode();
        for (Map.Entry<String, LayoutBox> entry : positions.asMap().entrySet()) {
            LayoutBox box = entry.getValue();
            ObjectNode b = root.putObject(entry.getKey());
            b.put("x", box.getX());
            b.put("y", box.getY());
            b.put("width", box.getWidth());
            b.put("height", box.getHeight());
        }
        return root;
    }

    private ObjectNode node(IrNode node) {
        ObjectNode n = mapper.createObjectNode();
        n.put("id", node.id());
        if (node instanceof IrContainerNode container) {
            n.put("kind", "container");
            n.put("containerType", container.containerType().token());
            n.set("params", values(container.params()));
            ArrayNode children = n.putArray("children");
            for (NodeRef child : container.children()) {
                children.addObject().put("ref", child.ref());
            }
        } else {
            IrComponentNode component = (IrComponentNode) node;
            n.put("kind", "component");
            n.put("componentType", component.componentType());
            n.set("props", values(component.props()));
        }
        n.set("style", nodeStyle(node.style()));
        n.set("meta", meta(node.meta()));
        return n;
    }

    private ObjectNode style(IrStyle style) {
        ObjectNode s = mapper.createObjectNode();
        s.put("density", style.density().token());
        s.put("spacing", style.spacing());
        s.put("radius", style.radius());
        s.put("stroke", style.stroke());
        s.put("font", style.font());
        putIfPresent(s, "background", style.background());
        putIfPresent(s, "theme", style.theme());
        putIfPresent(s, "device", style.device());
        return s;
    }

    private ObjectNode nodeStyle(IrNodeStyle style) {
        ObjectNode s = mapper.createObjectNode();
        putIfPresent(s, "padding", style.padding());
        putIfPresent(s, "gap", style.gap());
        putIfPresent(s, "align", style.align());
        putIfPresent(s, "justify", style.justify());
        putIfPresent(s, "background", style.background());
        return s;
    }

    private ObjectNode meta(IrMeta meta) {
        ObjectNode m = mapper.createObjectNode();
        putIfPresent(m, "source", meta.source());
        putIfPresent(m, "nodeId", meta.nodeId());
        return m;
    }

    private ObjectNode values(Map<String, IrValue> values) {
        ObjectNode o = mapper.createObjectNode();
        for (Map.Entry<String, IrValue> entry : values.entrySet()) {
            IrValue value = entry.getValue();
            if (value instanceof IrValue.Num num) {
                double d = num.value();
                if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                    o.put(entry.getKey(), (long) d);
                } else {
                    o.put(entry.getKey(), d);
                }
            } else {
                o.put(entry.getKey(), value.asText());
            }
        }
        return o;
    }

    private ObjectNode strings(Map<String, String> values) {
        ObjectNode o = mapper.createObjectNode();
        values.forEach(o::put);
        return o;
    }

    private static void putIfPresent(ObjectNode target, String key, String value) {
        if (value != null) target.put(key, value);
    }

    private String serialize(ObjectNode json) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON tree", e);
        }
    }
}
