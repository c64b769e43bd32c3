package org.wiredsl.compiler.frontend.irgen;

import org.wiredsl.compiler.frontend.ast.AstNode;
import org.wiredsl.compiler.ir.IrValue;
import org.wiredsl.compiler.util.OrderedMaps;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The binding scope of one macro invocation.
 * <p>
 * The argument map is fixed at creation. The only mutable part is the set of argument names
 * consumed so far, used to report unused arguments once the invocation has been expanded.
 * Scopes never chain: a nested invocation sees only the arguments its own caller passed.
 */
public final class ExpansionContext {

	/** The kind of macro a scope belongs to. */
	public enum Kind {
		COMPONENT("component"),
		LAYOUT("layout");

		private final String label;

		Kind(String label) {
			this.label = label;
		}

		public String label() {
			return label;
		}
	}

	/**
	 * Content passed as the single child of a defined layout, together with the scope it was
	 * written in. Slot content is lowered in that scope, not in the layout body's scope.
	 *
	 * @param content The child node.
	 * @param scope   The scope of the invocation site.
	 */
	public record Slot(AstNode content, ExpansionContext scope) {}

	private final Map<String, IrValue> args;
	private final Set<String> consumed = new HashSet<>();
	private final String definitionName;
	private final Kind kind;
	private final boolean allowsChildrenSlot;
	private final Slot slot;

	private ExpansionContext(Map<String, IrValue> args, String definitionName, Kind kind, boolean allowsChildrenSlot, Slot slot) {
		this.args = OrderedMaps.copyOf(args);
		this.definitionName = definitionName;
		this.kind = kind;
		this.allowsChildrenSlot = allowsChildrenSlot;
		this.slot = slot;
	}

	/**
	 * @return The scope of screen content outside any macro.
	 */
	public static ExpansionContext root() {
		return new ExpansionContext(Map.of(), null, null, false, null);
	}

	/**
	 * @param name The defined component name.
	 * @param args The caller's resolved props.
	 * @return A scope without a children slot.
	 */
	public static ExpansionContext forComponent(String name, Map<String, IrValue> args) {
		return new ExpansionContext(args, name, Kind.COMPONENT, false, null);
	}

	/**
	 * @param name The defined layout name.
	 * @param args The caller's resolved params.
	 * @param slot The resolved slot content, empty if none could be resolved.
	 * @return A scope in which {@code Children} may appear.
	 */
	public static ExpansionContext forLayout(String name, Map<String, IrValue> args, Optional<Slot> slot) {
		return new ExpansionContext(args, name, Kind.LAYOUT, true, slot.orElse(null));
	}

	/**
	 * @return {@code true} outside any macro invocation.
	 */
	public boolean isRoot() {
		return kind == null;
	}

	/**
	 * Looks up an argument and marks it consumed when present.
	 * @param name The argument name.
	 * @return The argument value, or empty if the caller did not supply it.
	 */
	public Optional<IrValue> lookup(String name) {
		IrValue value = args.get(name);
		if (value == null) return Optional.empty();
		consumed.add(name);
		return Optional.of(value);
	}

	/**
	 * @return Supplied argument names that were never looked up, in supply order.
	 */
	public List<String> unusedArguments() {
		List<String> unused = new ArrayList<>();
		for (String name : args.keySet()) {
			if (!consumed.contains(name)) unused.add(name);
		}
		return unused;
	}

	public Map<String, IrValue> arguments() {
		return args;
	}

	public String definitionName() {
		return definitionName;
	}

	public Kind kind() {
		return kind;
	}

	public boolean allowsChildrenSlot() {
		return allowsChildrenSlot;
	}

	public Optional<Slot> slot() {
		return Optional.ofNullable(slot);
	}
}
