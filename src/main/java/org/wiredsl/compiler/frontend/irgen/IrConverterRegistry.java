package org.wiredsl.compiler.frontend.irgen;

import org.wiredsl.compiler.frontend.ast.AstNode;
import org.wiredsl.compiler.frontend.ast.CellNode;
import org.wiredsl.compiler.frontend.ast.ComponentNode;
import org.wiredsl.compiler.frontend.ast.LayoutNode;
import org.wiredsl.compiler.frontend.irgen.converters.CellNodeConverter;
import org.wiredsl.compiler.frontend.irgen.converters.ComponentNodeConverter;
import org.wiredsl.compiler.frontend.irgen.converters.LayoutNodeConverter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping syntax tree node classes to converter instances.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byClass = new HashMap<>();

	private IrConverterRegistry() {
	}

	/**
	 * Registers a converter for the given node class, replacing any previous one.
	 *
	 * @param nodeType  The concrete node class.
	 * @param converter The converter instance handling that class.
	 * @param <T>       Concrete node type parameter.
	 */
	public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * @param nodeType The node class to look up.
	 * @return Optional converter if present.
	 */
	public Optional<IAstNodeToIrConverter<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
		return Optional.ofNullable(byClass.get(nodeType));
	}

	/**
	 * Resolves the converter for the given node.
	 *
	 * @param node The node to resolve a converter for.
	 * @return A non-null converter.
	 * @throws IllegalStateException if no converter is registered for the node's class.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToIrConverter<AstNode> resolve(AstNode node) {
		IAstNodeToIrConverter<?> found = byClass.get(node.getClass());
		if (found == null) {
			throw new IllegalStateException("No IR converter registered for " + node.getClass().getSimpleName());
		}
		return (IAstNodeToIrConverter<AstNode>) found;
	}

	/**
	 * @return An empty registry; callers register converters themselves.
	 */
	public static IrConverterRegistry initialize() {
		return new IrConverterRegistry();
	}

	/**
	 * @return A registry pre-populated with the converters for layouts, components and cells.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize();
		reg.register(LayoutNode.class, new LayoutNodeConverter());
		reg.register(ComponentNode.class, new ComponentNodeConverter());
		reg.register(CellNode.class, new CellNodeConverter());
		return reg;
	}
}
