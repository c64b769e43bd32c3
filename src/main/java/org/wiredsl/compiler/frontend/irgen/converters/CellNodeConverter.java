package org.wiredsl.compiler.frontend.irgen.converters;

import org.wiredsl.compiler.frontend.ast.CellNode;
import org.wiredsl.compiler.frontend.irgen.BindingResolver;
import org.wiredsl.compiler.frontend.irgen.ExpansionContext;
import org.wiredsl.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.wiredsl.compiler.frontend.irgen.IrGenContext;
import org.wiredsl.compiler.ir.ContainerType;
import org.wiredsl.compiler.ir.IrContainerNode;
import org.wiredsl.compiler.ir.IrMeta;
import org.wiredsl.compiler.ir.IrNodeStyle;
import org.wiredsl.compiler.ir.IrValue;
import org.wiredsl.compiler.ir.NodeRef;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lowers a grid {@link CellNode} into a stack container tagged with {@code source = "cell"}.
 * Cell props (span, align, ...) are kept verbatim as params; the grid gap provides spacing, so
 * cells carry no padding.
 */
public final class CellNodeConverter implements IAstNodeToIrConverter<CellNode> {

	private static final String CELL_TARGET = "cell";

	@Override
	public Optional<String> convert(CellNode node, ExpansionContext scope, IrGenContext ctx) {
		String id = ctx.nextNodeId();
		List<NodeRef> children = ctx.convertChildren(node.children(), scope);
		Map<String, IrValue> params = ctx.bindings().resolveAll(node.props(), scope,
				BindingResolver.TargetKind.LAYOUT_PARAMETER, CELL_TARGET);

		ctx.register(new IrContainerNode(id, ContainerType.STACK, params, children,
				new IrNodeStyle("none", null, null, null, null),
				new IrMeta(IrMeta.SOURCE_CELL, node.nodeId().orElse(null))));
		return Optional.of(id);
	}
}
