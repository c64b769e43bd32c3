package org.wiredsl.compiler.frontend.irgen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wiredsl.compiler.api.CompilerErrorCode;
import org.wiredsl.compiler.frontend.ast.AstNode;
import org.wiredsl.compiler.frontend.ast.ComponentNode;
import org.wiredsl.compiler.frontend.ast.DefinedComponentNode;
import org.wiredsl.compiler.frontend.ast.DefinedLayoutNode;
import org.wiredsl.compiler.frontend.ast.LayoutNode;
import org.wiredsl.compiler.ir.IrValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expands invocations of defined components and defined layouts.
 * <p>
 * Both entry points build a fresh scope for the invocation and then share {@link #expandBody}, which
 * lowers the definition body and reports arguments the body never consumed.
 */
public final class MacroExpander {

	private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);

	/**
	 * Expands a defined component.
	 *
	 * @param definition The definition.
	 * @param args       The caller's resolved props.
	 * @param ctx        The generation context.
	 * @return The id of the node replacing the invocation, or empty on error.
	 */
	public Optional<String> expandComponent(DefinedComponentNode definition, Map<String, IrValue> args, IrGenContext ctx) {
		AstNode body = definition.body();
		if (!(body instanceof LayoutNode) && !(body instanceof ComponentNode)) {
			ctx.diagnostics().reportError(CompilerErrorCode.INVALID_DEFINITION_BODY,
					String.format("Invalid defined component body type for \"%s\".", definition.name()));
			return Optional.empty();
		}
		return expandBody(body, ExpansionContext.forComponent(definition.name(), args), ctx);
	}

	/**
	 * Expands a defined layout.
	 * <p>
	 * Exactly one child is expected. A lone {@code Children} child forwards the caller's own slot.
	 *
	 * @param definition  The definition.
	 * @param params      The caller's resolved params.
	 * @param children    The children written at the invocation site.
	 * @param callerScope The scope of the invocation site.
	 * @param ctx         The generation context.
	 * @return The id of the node replacing the invocation, or empty on error.
	 */
	public Optional<String> expandLayout(DefinedLayoutNode definition, Map<String, IrValue> params,
										 List<AstNode> children, ExpansionContext callerScope, IrGenContext ctx) {
		if (children.size() != 1) {
			ctx.diagnostics().reportError(CompilerErrorCode.LAYOUT_CHILDREN_ARITY,
					String.format("Layout \"%s\" expects exactly one child, received %d.", definition.name(), children.size()));
		}

		Optional<ExpansionContext.Slot> slot = Optional.empty();
		if (!children.isEmpty()) {
			AstNode raw = children.get(0);
			if (raw instanceof ComponentNode component && component.isChildrenSlot()) {
				if (callerScope.allowsChildrenSlot()) {
					slot = callerScope.slot();
				} else {
					ctx.diagnostics().reportError(CompilerErrorCode.CHILDREN_SLOT_OUTSIDE_DEFINITION,
							"\"Children\" placeholder forwarding is only valid inside define Layout bodies.");
				}
			} else {
				slot = Optional.of(new ExpansionContext.Slot(raw, callerScope));
			}
		}

		return expandBody(definition.body(), ExpansionContext.forLayout(definition.name(), params, slot), ctx);
	}

	private Optional<String> expandBody(AstNode body, ExpansionContext scope, IrGenContext ctx) {
		LOG.debug("Expanding {} '{}' with arguments {}", scope.kind().label(), scope.definitionName(), scope.arguments().keySet());
		Optional<String> result = ctx.convert(body, scope);
		for (String unused : scope.unusedArguments()) {
			ctx.diagnostics().reportWarning(CompilerErrorCode.UNUSED_DEFINITION_ARGUMENT,
					String.format("Argument \"%s\" is not used by %s \"%s\".", unused, scope.kind().label(), scope.definitionName()));
		}
		return result;
	}
}
