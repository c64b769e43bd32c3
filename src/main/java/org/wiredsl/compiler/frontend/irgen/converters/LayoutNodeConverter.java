package org.wiredsl.compiler.frontend.irgen.converters;

import org.wiredsl.compiler.api.CompilerErrorCode;
import org.wiredsl.compiler.frontend.ast.DefinedLayoutNode;
import org.wiredsl.compiler.frontend.ast.LayoutNode;
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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers a {@link LayoutNode} into an {@link IrContainerNode}, or delegates to defined-layout
 * expansion when the layout type names a definition.
 * <p>
 * Style-only params (padding, gap, align, justify) move into the node style; every other param,
 * background included, stays in the params map.
 */
public final class LayoutNodeConverter implements IAstNodeToIrConverter<LayoutNode> {

	private static final Set<String> STYLE_KEYS = Set.of("padding", "gap", "align", "justify");
	private static final Set<String> ALIGN_VALUES = Set.of("left", "center", "right", "justify", "start", "end");
	private static final Set<String> JUSTIFY_VALUES = Set.of("start", "center", "end", "spaceBetween", "spaceAround", "stretch");

	@Override
	public Optional<String> convert(LayoutNode node, ExpansionContext scope, IrGenContext ctx) {
		Map<String, IrValue> params = ctx.bindings().resolveAll(node.params(), scope,
				BindingResolver.TargetKind.LAYOUT_PARAMETER, node.layoutType());

		Optional<DefinedLayoutNode> definition = ctx.definitions().layout(node.layoutType());
		if (definition.isPresent()) {
			return ctx.macros().expandLayout(definition.get(), params, node.children(), scope, ctx);
		}

		Optional<ContainerType> containerType = ContainerType.fromName(node.layoutType());
		if (containerType.isEmpty()) {
			ctx.diagnostics().reportError(CompilerErrorCode.UNKNOWN_CONTAINER_TYPE,
					String.format("Unknown layout type \"%s\". Use stack, grid, split, panel, card or define Layout \"%s\" { ... }.",
							node.layoutType(), node.layoutType()));
			return Optional.empty();
		}

		String id = ctx.nextNodeId();
		List<NodeRef> children = ctx.convertChildren(node.children(), scope);
		int capacity = containerType.get().maxChildren();
		if (children.size() > capacity) {
			ctx.diagnostics().reportWarning(CompilerErrorCode.EXTRA_CONTAINER_CHILDREN,
					String.format("%s %s has %d children but lays out at most %d; the rest are collapsed.",
							node.layoutType(), id, children.size(), capacity));
		}

		IrNodeStyle style = new IrNodeStyle(
				params.containsKey("padding") ? params.get("padding").asText() : "none",
				params.containsKey("gap") ? params.get("gap").asText() : null,
				enumValue(params, "align", ALIGN_VALUES, id, ctx),
				enumValue(params, "justify", JUSTIFY_VALUES, id, ctx),
				params.containsKey("background") ? params.get("background").asText() : null);

		Map<String, IrValue> cleaned = new LinkedHashMap<>();
		params.forEach((key, value) -> {
			if (!STYLE_KEYS.contains(key)) cleaned.put(key, value);
		});

		ctx.register(new IrContainerNode(id, containerType.get(), cleaned, children, style,
				new IrMeta(null, node.nodeId().orElse(null))));
		return Optional.of(id);
	}

	private static String enumValue(Map<String, IrValue> params, String key, Set<String> allowed, String nodeId, IrGenContext ctx) {
		IrValue value = params.get(key);
		if (value == null) return null;
		String text = value.asText();
		if (allowed.contains(text)) return text;
		ctx.diagnostics().reportWarning(CompilerErrorCode.INVALID_STYLE_VALUE,
				String.format("Invalid %s \"%s\" on %s; the value is ignored.", key, text, nodeId));
		return null;
	}
}
