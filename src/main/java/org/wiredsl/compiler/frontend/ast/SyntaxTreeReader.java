package org.wiredsl.compiler.frontend.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wiredsl.compiler.api.CompilationException;
import org.wiredsl.compiler.api.CompilerErrorCode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the JSON syntax tree emitted by the external parser into the typed {@link ProjectNode} model.
 * <p>
 * The parser marks macro argument references as strings of the form {@code prop_<name>}. This reader
 * is the only place that marker is decoded; everything downstream sees {@link PropertyValue.BoundArgument}.
 */
public final class SyntaxTreeReader {

    private static final Logger LOG = LoggerFactory.getLogger(SyntaxTreeReader.class);

    /** The string prefix the parser uses for bound argument references. */
    public static final String BOUND_ARGUMENT_PREFIX = "prop_";

    private final ObjectMapper mapper;

    public SyntaxTreeReader() {
        this(new ObjectMapper());
    }

    public SyntaxTreeReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reads a project from a JSON file.
     * @param path The file to read.
     * @return The parsed project.
     * @throws CompilationException if the file cannot be read or does not describe a project.
     */
    public ProjectNode read(Path path) throws CompilationException {
        LOG.debug("Reading syntax tree from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return toProject(mapper.readTree(in));
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_INPUT, "Cannot read syntax tree from " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a project from a JSON string.
     * @param json The JSON document.
     * @return The parsed project.
     * @throws CompilationException if the document is malformed or does not describe a project.
     */
    public ProjectNode read(String json) throws CompilationException {
        try {
            return toProject(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_INPUT, "Malformed syntax tree JSON: " + e.getOriginalMessage(), e);
        }
    }

    private ProjectNode toProject(JsonNode root) throws CompilationException {
        if (root == null || !root.isObject()) {
            throw invalid("Syntax tree root must be a JSON object");
        }
        List<DefinedComponentNode> components = new ArrayList<>();
        for (JsonNode def : array(root, "definedComponents")) {
            components.add(new DefinedComponentNode(requiredText(def, "name"), toNode(def.get("body")), nodeId(def)));
        }
        List<DefinedLayoutNode> layouts = new ArrayList<>();
        for (JsonNode def : array(root, "definedLayouts")) {
            AstNode body = toNode(def.get("body"));
            if (!(body instanceof LayoutNode layoutBody)) {
                throw invalid("Body of defined layout '" + def.path("name").asText() + "' must be a layout");
            }
            layouts.add(new DefinedLayoutNode(requiredText(def, "name"), layoutBody, nodeId(def)));
        }
        List<ScreenNode> screens = new ArrayList<>();
        for (JsonNode screen : array(root, "screens")) {
            AstNode layout = toNode(screen.get("layout"));
            if (!(layout instanceof LayoutNode rootLayout)) {
                throw invalid("Screen '" + screen.path("name").asText() + "' must have a layout root");
            }
            screens.add(new ScreenNode(requiredText(screen, "name"), values(screen.get("params")), rootLayout, nodeId(screen)));
        }
        return new ProjectNode(
                root.path("name").asText(""),
                strings(root.get("style")),
                strings(root.get("colors")),
                strings(root.get("mocks")),
                components,
                layouts,
                screens);
    }

    private AstNode toNode(JsonNode json) throws CompilationException {
        if (json == null || !json.isObject()) {
            throw invalid("Expected a syntax tree node object");
        }
        String type = json.path("type").asText();
        switch (type) {
            case "layout":
                return new LayoutNode(requiredText(json, "layoutType"), values(json.get("params")), children(json), nodeId(json));
            case "component":
                return new ComponentNode(requiredText(json, "componentType"), values(json.get("props")), nodeId(json));
            case "cell":
                List<AstNode> cellChildren = children(json);
                for (AstNode child : cellChildren) {
                    if (child instanceof CellNode) throw invalid("A cell cannot directly contain another cell");
                }
                return new CellNode(values(json.get("props")), cellChildren, nodeId(json));
            default:
                throw invalid("Unknown syntax tree node type '" + type + "'");
        }
    }

    private List<AstNode> children(JsonNode json) throws CompilationException {
        List<AstNode> result = new ArrayList<>();
        for (JsonNode child : array(json, "children")) {
            result.add(toNode(child));
        }
        return result;
    }

    private Map<String, PropertyValue> values(JsonNode json) throws CompilationException {
        Map<String, PropertyValue> result = new LinkedHashMap<>();
        if (json == null || json.isNull()) return result;
        if (!json.isObject()) throw invalid("Expected an object of properties");
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), toValue(field.getKey(), field.getValue()));
        }
        return result;
    }

    private PropertyValue toValue(String key, JsonNode value) throws CompilationException {
        if (value.isNumber()) {
            return new PropertyValue.Num(value.doubleValue());
        }
        if (value.isTextual()) {
            String text = value.asText();
            if (text.startsWith(BOUND_ARGUMENT_PREFIX) && text.length() > BOUND_ARGUMENT_PREFIX.length()) {
                return new PropertyValue.BoundArgument(text.substring(BOUND_ARGUMENT_PREFIX.length()));
            }
            return new PropertyValue.Str(text);
        }
        if (value.isBoolean()) {
            return new PropertyValue.Str(value.asText());
        }
        throw invalid("Property '" + key + "' must be a string or a number");
    }

    private static Map<String, String> strings(JsonNode json) {
        Map<String, String> result = new LinkedHashMap<>();
        if (json == null || !json.isObject()) return result;
        json.fields().forEachRemaining(e -> result.put(e.getKey(), e.getValue().asText()));
        return result;
    }

    private static Iterable<JsonNode> array(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        return node != null && node.isArray() ? node : List.of();
    }

    private static Optional<String> nodeId(JsonNode json) {
        JsonNode id = json.path("_meta").path("nodeId");
        return id.isTextual() ? Optional.of(id.asText()) : Optional.empty();
    }

    private static String requiredText(JsonNode json, String field) throws CompilationException {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual()) {
            throw invalid("Missing string field '" + field + "'");
        }
        return value.asText();
    }

    private static CompilationException invalid(String message) {
        return new CompilationException(CompilerErrorCode.INVALID_INPUT, message, List.of());
    }
}
