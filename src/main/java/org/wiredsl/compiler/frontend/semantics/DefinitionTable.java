package org.wiredsl.compiler.frontend.semantics;

import org.wiredsl.compiler.api.CompilerErrorCode;
import org.wiredsl.compiler.diagnostics.DiagnosticsEngine;
import org.wiredsl.compiler.frontend.ast.DefinedComponentNode;
import org.wiredsl.compiler.frontend.ast.DefinedLayoutNode;
import org.wiredsl.compiler.frontend.ast.ProjectNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the user-defined components and layouts of a project, keyed by name.
 * <p>
 * All definitions are registered before any screen is lowered, so a definition may be used
 * before it is declared. Redefining a name replaces the earlier definition and is reported as a warning.
 */
public class DefinitionTable {

    private final Map<String, DefinedComponentNode> components = new LinkedHashMap<>();
    private final Map<String, DefinedLayoutNode> layouts = new LinkedHashMap<>();
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new, empty definition table.
     * @param diagnostics The engine duplicate definitions are reported to.
     */
    public DefinitionTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Registers every definition of the given project in declaration order.
     * @param project The project whose definitions are registered.
     */
    public void registerAll(ProjectNode project) {
        project.definedComponents().forEach(this::defineComponent);
        project.definedLayouts().forEach(this::defineLayout);
    }

    public void defineComponent(DefinedComponentNode definition) {
        DefinedComponentNode previous = components.put(definition.name(), definition);
        if (previous != null) {
            diagnostics.reportWarning(CompilerErrorCode.DUPLICATE_DEFINITION,
                    String.format("Component \"%s\" is defined more than once; the last definition is used.", definition.name()));
        }
    }

    public void defineLayout(DefinedLayoutNode definition) {
        DefinedLayoutNode previous = layouts.put(definition.name(), definition);
        if (previous != null) {
            diagnostics.reportWarning(CompilerErrorCode.DUPLICATE_DEFINITION,
                    String.format("Layout \"%s\" is defined more than once; the last definition is used.", definition.name()));
        }
    }

    public Optional<DefinedComponentNode> component(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public Optional<DefinedLayoutNode> layout(String name) {
        return Optional.ofNullable(layouts.get(name));
    }

    public boolean hasComponent(String name) {
        return components.containsKey(name);
    }

    public boolean hasLayout(String name) {
        return layouts.containsKey(name);
    }
}
