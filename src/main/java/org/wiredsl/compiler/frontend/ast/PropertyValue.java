package org.wiredsl.compiler.frontend.ast;

/**
 * A property or parameter value in the syntax tree: either a literal or a reference to a
 * macro argument that is bound during expansion.
 */
public sealed interface PropertyValue permits PropertyValue.Str, PropertyValue.Num, PropertyValue.BoundArgument {

    /** A literal string value. */
    record Str(String value) implements PropertyValue {
        public Str {
            if (value == null) throw new IllegalArgumentException("value must not be null");
        }
    }

    /** A literal numeric value. */
    record Num(double value) implements PropertyValue {}

    /** A reference to an argument of the enclosing defined component or layout. */
    record BoundArgument(String name) implements PropertyValue {
        public BoundArgument {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("argument name must not be blank");
        }
    }

    static PropertyValue of(String value) {
        return new Str(value);
    }

    static PropertyValue of(double value) {
        return new Num(value);
    }

    static PropertyValue bind(String argumentName) {
        return new BoundArgument(argumentName);
    }
}
