package org.wiredsl.compiler.ir;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Structural check of a freshly built contract. A violation indicates a bug in the generator,
 * not a user error, and is raised as {@link IllegalStateException}.
 */
public final class IrContractValidator {

	private static final Set<String> ALIGN_VALUES = Set.of("left", "center", "right", "justify", "start", "end");
	private static final Set<String> JUSTIFY_VALUES = Set.of("start", "center", "end", "spaceBetween", "spaceAround", "stretch");

	private IrContractValidator() {}

	/**
	 * Validates the contract.
	 * @param contract The contract to check.
	 * @throws IllegalStateException if any structural invariant is violated.
	 */
	public static void validate(IrContract contract) {
		if (!IrContract.IR_VERSION.equals(contract.irVersion())) {
			throw new IllegalStateException("Unsupported IR version " + contract.irVersion());
		}
		IrProject project = contract.project();
		validateStyle(project.style());

		Map<String, IrNode> nodes = project.nodes();
		for (Map.Entry<String, IrNode> entry : nodes.entrySet()) {
			IrNode node = entry.getValue();
			if (!entry.getKey().equals(node.id())) {
				throw new IllegalStateException("Node stored under '" + entry.getKey() + "' has id '" + node.id() + "'");
			}
			validateNodeStyle(node);
			if (node instanceof IrContainerNode container) {
				if (container.containerType() == null) {
					throw new IllegalStateException("Container '" + node.id() + "' has no container type");
				}
				for (NodeRef child : container.children()) {
					if (!nodes.containsKey(child.ref())) {
						throw new IllegalStateException("Container '" + node.id() + "' references unknown node '" + child.ref() + "'");
					}
				}
			}
		}

		Set<String> reachable = new HashSet<>();
		Deque<String> pending = new ArrayDeque<>();
		for (IrScreen screen : project.screens()) {
			if (!nodes.containsKey(screen.root().ref())) {
				throw new IllegalStateException("Screen '" + screen.id() + "' references unknown root '" + screen.root().ref() + "'");
			}
			pending.push(screen.root().ref());
		}
		while (!pending.isEmpty()) {
			String id = pending.pop();
			if (!reachable.add(id)) continue;
			if (nodes.get(id) instanceof IrContainerNode container) {
				container.children().forEach(c -> pending.push(c.ref()));
			}
		}
		for (String id : nodes.keySet()) {
			if (!reachable.contains(id)) {
				throw new IllegalStateException("Node '" + id + "' is not reachable from any screen");
			}
		}
	}

	private static void validateStyle(IrStyle style) {
		if (style.density() == null) throw new IllegalStateException("Project style has no density");
		requireIn("spacing", style.spacing(), IrStyle.SPACING_VALUES);
		requireIn("radius", style.radius(), IrStyle.RADIUS_VALUES);
		requireIn("stroke", style.stroke(), IrStyle.STROKE_VALUES);
		requireIn("font", style.font(), IrStyle.FONT_VALUES);
	}

	private static void validateNodeStyle(IrNode node) {
		IrNodeStyle style = node.style();
		if (style.align() != null) requireIn("align of " + node.id(), style.align(), ALIGN_VALUES);
		if (style.justify() != null) requireIn("justify of " + node.id(), style.justify(), JUSTIFY_VALUES);
	}

	private static void requireIn(String field, String value, Set<String> allowed) {
		if (!allowed.contains(value)) {
			throw new IllegalStateException("Style " + field + " has out-of-range value '" + value + "'");
		}
	}
}
