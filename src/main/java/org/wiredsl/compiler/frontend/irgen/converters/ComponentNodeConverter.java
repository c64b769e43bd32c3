package org.wiredsl.compiler.frontend.irgen.converters;

import org.wiredsl.compiler.api.CompilerErrorCode;
import org.wiredsl.compiler.frontend.ast.ComponentNode;
import org.wiredsl.compiler.frontend.ast.DefinedComponentNode;
import org.wiredsl.compiler.frontend.irgen.BindingResolver;
import org.wiredsl.compiler.frontend.irgen.ExpansionContext;
import org.wiredsl.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.wiredsl.compiler.frontend.irgen.IrGenContext;
import org.wiredsl.compiler.frontend.semantics.BuiltinCatalog;
import org.wiredsl.compiler.ir.IrComponentNode;
import org.wiredsl.compiler.ir.IrMeta;
import org.wiredsl.compiler.ir.IrNodeStyle;
import org.wiredsl.compiler.ir.IrValue;

import java.util.Map;
import java.util.Optional;

/**
 * Lowers a {@link ComponentNode}: resolves the {@code Children} slot, expands defined components,
 * or registers a plain component node.
 */
public final class ComponentNodeConverter implements IAstNodeToIrConverter<ComponentNode> {

	@Override
	public Optional<String> convert(ComponentNode node, ExpansionContext scope, IrGenContext ctx) {
		if (node.isChildrenSlot()) {
			return convertSlot(scope, ctx);
		}

		Map<String, IrValue> props = ctx.bindings().resolveAll(node.props(), scope,
				BindingResolver.TargetKind.COMPONENT_PROPERTY, node.componentType());

		Optional<DefinedComponentNode> definition = ctx.definitions().component(node.componentType());
		if (definition.isPresent()) {
			return ctx.macros().expandComponent(definition.get(), props, ctx);
		}

		if (!BuiltinCatalog.isBuiltinComponent(node.componentType())) {
			ctx.markUndefined(node.componentType());
		}

		String id = ctx.nextNodeId();
		ctx.register(new IrComponentNode(id, node.componentType(), props, IrNodeStyle.empty(),
				new IrMeta(null, node.nodeId().orElse(null))));
		return Optional.of(id);
	}

	// A missing slot inside a layout body was already reported by the invocation.
	private Optional<String> convertSlot(ExpansionContext scope, IrGenContext ctx) {
		if (!scope.allowsChildrenSlot()) {
			ctx.diagnostics().reportError(CompilerErrorCode.CHILDREN_SLOT_OUTSIDE_DEFINITION,
					"\"Children\" placeholder can only be used inside a define Layout body.");
			return Optional.empty();
		}
		return scope.slot().flatMap(slot -> ctx.convert(slot.content(), slot.scope()));
	}
}
