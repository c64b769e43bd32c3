package org.wiredsl.compiler.frontend.irgen;

import org.wiredsl.compiler.api.CompilerErrorCode;
import org.wiredsl.compiler.diagnostics.DiagnosticsEngine;
import org.wiredsl.compiler.frontend.ast.PropertyValue;
import org.wiredsl.compiler.frontend.semantics.BuiltinCatalog;
import org.wiredsl.compiler.ir.IrValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves property and parameter values against the active {@link ExpansionContext}.
 */
public final class BindingResolver {

	/** What a value is being resolved for; decides which metadata marks it required. */
	public enum TargetKind {
		COMPONENT_PROPERTY("property", "component"),
		LAYOUT_PARAMETER("parameter", "layout");

		private final String descriptor;
		private final String owner;

		TargetKind(String descriptor, String owner) {
			this.descriptor = descriptor;
			this.owner = owner;
		}
	}

	private final DiagnosticsEngine diagnostics;

	public BindingResolver(DiagnosticsEngine diagnostics) {
		this.diagnostics = diagnostics;
	}

	/**
	 * Resolves every entry of a property map, dropping entries whose binding could not be satisfied.
	 *
	 * @param values     The raw values in declaration order.
	 * @param scope      The active scope.
	 * @param kind       Whether these are component props or layout params.
	 * @param targetType The component or layout type the values belong to.
	 * @return The resolved values in declaration order.
	 */
	public Map<String, IrValue> resolveAll(Map<String, PropertyValue> values, ExpansionContext scope,
										   TargetKind kind, String targetType) {
		Map<String, IrValue> resolved = new LinkedHashMap<>();
		for (Map.Entry<String, PropertyValue> entry : values.entrySet()) {
			resolve(entry.getValue(), scope, kind, targetType, entry.getKey())
					.ifPresent(v -> resolved.put(entry.getKey(), v));
		}
		return resolved;
	}

	/**
	 * Resolves a single value.
	 * <p>
	 * Literals are copied. A bound argument outside any macro is passed through as {@link IrValue.Unbound}.
	 * Inside a macro it is replaced by the caller's argument; a missing argument is an error for required
	 * targets and a warning otherwise, and yields no value.
	 *
	 * @return The resolved value, or empty if the target must be omitted.
	 */
	public Optional<IrValue> resolve(PropertyValue value, ExpansionContext scope, TargetKind kind,
									 String targetType, String targetName) {
		if (value instanceof PropertyValue.Str s) return Optional.of(new IrValue.Str(s.value()));
		if (value instanceof PropertyValue.Num n) return Optional.of(new IrValue.Num(n.value()));

		String argName = ((PropertyValue.BoundArgument) value).name();
		if (scope.isRoot()) {
			return Optional.of(new IrValue.Unbound(argName));
		}
		Optional<IrValue> bound = scope.lookup(argName);
		if (bound.isPresent()) {
			return bound;
		}

		if (isRequired(kind, targetType, targetName)) {
			diagnostics.reportError(CompilerErrorCode.MISSING_REQUIRED_BOUND_VALUE, String.format(
					"Missing required bound %s \"%s\" for %s \"%s\" in %s \"%s\" (expected arg \"%s\").",
					kind.descriptor, targetName, kind.owner, targetType,
					scope.kind().label(), scope.definitionName(), argName));
		} else {
			diagnostics.reportWarning(CompilerErrorCode.MISSING_BOUND_VALUE, String.format(
					"Optional %s \"%s\" in %s \"%s\" was omitted because arg \"%s\" was not provided while expanding %s \"%s\".",
					kind.descriptor, targetName, kind.owner, targetType, argName,
					scope.kind().label(), scope.definitionName()));
		}
		return Optional.empty();
	}

	private static boolean isRequired(TargetKind kind, String targetType, String targetName) {
		return kind == TargetKind.COMPONENT_PROPERTY
				? BuiltinCatalog.isRequiredComponentProp(targetType, targetName)
				: BuiltinCatalog.isRequiredLayoutParam(targetType, targetName);
	}
}
