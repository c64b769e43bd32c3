package org.wiredsl.compiler.frontend.irgen;

import org.wiredsl.compiler.diagnostics.DiagnosticsEngine;
import org.wiredsl.compiler.frontend.ast.AstNode;
import org.wiredsl.compiler.frontend.semantics.DefinitionTable;
import org.wiredsl.compiler.ir.IrNode;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable state of one IR generation run, passed to converters.
 * Provides node registration, id allocation, diagnostics access and recursive conversion.
 */
public final class IrGenContext {

	static final String NODE_ID_PREFIX = "node";

	private final DiagnosticsEngine diagnostics;
	private final DefinitionTable definitions;
	private final IdGenerator ids;
	private final IrConverterRegistry registry;
	private final BindingResolver bindings;
	private final MacroExpander macros;
	private final Map<String, IrNode> nodes = new LinkedHashMap<>();
	private final SortedSet<String> undefinedComponents = new TreeSet<>();

	/**
	 * Constructs a new IR generation context.
	 * @param diagnostics The engine errors and warnings are reported to.
	 * @param definitions The registered component and layout definitions.
	 * @param ids The id generator of this run.
	 * @param registry The registry for resolving node converters.
	 */
	public IrGenContext(DiagnosticsEngine diagnostics, DefinitionTable definitions, IdGenerator ids, IrConverterRegistry registry) {
		this.diagnostics = diagnostics;
		this.definitions = definitions;
		this.ids = ids;
		this.registry = registry;
		this.bindings = new BindingResolver(diagnostics);
		this.macros = new MacroExpander();
	}

	/**
	 * Lowers the given node by resolving and invoking the appropriate converter.
	 * @param node The node to lower.
	 * @param scope The scope the node was written in.
	 * @return The id of the produced node, or empty.
	 */
	public Optional<String> convert(AstNode node, ExpansionContext scope) {
		return registry.resolve(node).convert(node, scope, this);
	}

	/**
	 * Lowers children in order, skipping those that produced no node.
	 * @param children The child nodes.
	 * @param scope The scope the children were written in.
	 * @return References to the produced nodes.
	 */
	public List<NodeRef> convertChildren(List<AstNode> children, ExpansionContext scope) {
		List<NodeRef> refs = new ArrayList<>();
		for (AstNode child : children) {
			convert(child, scope).ifPresent(id -> refs.add(new NodeRef(id)));
		}
		return refs;
	}

	/**
	 * @return A fresh node id.
	 */
	public String nextNodeId() {
		return ids.generate(NODE_ID_PREFIX);
	}

	/**
	 * Adds a finished node to the node map.
	 * @param node The node.
	 */
	public void register(IrNode node) {
		nodes.put(node.id(), node);
	}

	/**
	 * Records a component type that is neither built in nor defined.
	 * @param componentType The type name.
	 */
	public void markUndefined(String componentType) {
		undefinedComponents.add(componentType);
	}

	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public DefinitionTable definitions() {
		return definitions;
	}

	public BindingResolver bindings() {
		return bindings;
	}

	public MacroExpander macros() {
		return macros;
	}

	/**
	 * @return The node map in registration order.
	 */
	public Map<String, IrNode> nodes() {
		return Collections.unmodifiableMap(nodes);
	}

	/**
	 * @return Undefined component types, sorted and deduplicated.
	 */
	public Set<String> undefinedComponents() {
		return Collections.unmodifiableSortedSet(undefinedComponents);
	}
}
