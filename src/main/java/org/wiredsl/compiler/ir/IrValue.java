package org.wiredsl.compiler.ir;

import java.util.OptionalDouble;

/**
 * Typed value of an IR property or parameter. Designed to be serializable without leaking Object.
 */
public sealed interface IrValue permits IrValue.Str, IrValue.Num, IrValue.Unbound {

	/** Serialized marker prefix of an unbound argument reference. */
	String UNBOUND_PREFIX = "prop_";

	/**
	 * Represents a string value.
	 * @param value The string value.
	 */
	record Str(String value) implements IrValue {}

	/**
	 * Represents a numeric value.
	 * @param value The number.
	 */
	record Num(double value) implements IrValue {}

	/**
	 * An argument reference that appeared outside any macro. It is passed through to the renderer.
	 * @param argumentName The referenced argument name.
	 */
	record Unbound(String argumentName) implements IrValue {}

	/**
	 * @return The value as display text; integral numbers print without a fraction.
	 */
	default String asText() {
		if (this instanceof Str s) return s.value();
		if (this instanceof Num n) return formatNumber(n.value());
		return UNBOUND_PREFIX + ((Unbound) this).argumentName();
	}

	/**
	 * @return The value as a number, or empty if it is not numeric.
	 */
	default OptionalDouble asNumber() {
		if (this instanceof Num n) return OptionalDouble.of(n.value());
		if (this instanceof Str s) {
			String text = s.value().trim();
			if (text.isEmpty()) return OptionalDouble.empty();
			try {
				double parsed = Double.parseDouble(text);
				return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
			} catch (NumberFormatException e) {
				return OptionalDouble.empty();
			}
		}
		return OptionalDouble.empty();
	}

	static IrValue of(String value) {
		return new Str(value);
	}

	static IrValue of(double value) {
		return new Num(value);
	}

	static String formatNumber(double value) {
		if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
			return Long.toString((long) value);
		}
		return Double.toString(value);
	}
}
