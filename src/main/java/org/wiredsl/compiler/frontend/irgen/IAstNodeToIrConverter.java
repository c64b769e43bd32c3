package org.wiredsl.compiler.frontend.irgen;

import org.wiredsl.compiler.frontend.ast.AstNode;

import java.util.Optional;

/**
 * Lowers a specific syntax tree node type into IR nodes.
 * <p>
 * Implementations should be stateless. All nodes must be registered via the provided {@link IrGenContext}.
 *
 * @param <T> The concrete syntax tree node type handled by this converter.
 */
public interface IAstNodeToIrConverter<T extends AstNode> {

	/**
	 * Lowers the given node.
	 *
	 * @param node  The node to lower.
	 * @param scope The binding scope the node was written in.
	 * @param ctx   The generation context used to register nodes and access diagnostics.
	 * @return The id of the single node replacing {@code node}, or empty if nothing could be produced.
	 */
	Optional<String> convert(T node, ExpansionContext scope, IrGenContext ctx);
}
