package org.wiredsl.compiler.api;

/**
 * Defines unique, testable codes for all diagnostics that can occur during composition.
 * This decouples the test logic from the message texts.
 */
public enum CompilerErrorCode {
    // region Errors
    /** One or more component types are neither built in nor defined. */
    UNDEFINED_COMPONENTS_USED("undefined-components-used"),
    /** Composition finished with at least one semantic error. */
    COMPOSITION_FAILED("composition-failed"),
    /** A bound argument for a required property or parameter was not supplied. */
    MISSING_REQUIRED_BOUND_VALUE("missing-required-bound-value"),
    /** A defined layout was invoked with a child count other than one. */
    LAYOUT_CHILDREN_ARITY("layout-children-arity"),
    /** The {@code Children} placeholder was used where no slot can exist. */
    CHILDREN_SLOT_OUTSIDE_DEFINITION("children-slot-outside-definition"),
    /** A defined component body is neither a layout nor a component. */
    INVALID_DEFINITION_BODY("invalid-definition-body"),
    /** A layout names a container type that is neither built in nor defined. */
    UNKNOWN_CONTAINER_TYPE("unknown-container-type"),
    // endregion

    // region Warnings
    /** A bound argument for an optional property was not supplied; the property is omitted. */
    MISSING_BOUND_VALUE("missing-bound-value"),
    /** An argument was supplied to a macro but never referenced by its body. */
    UNUSED_DEFINITION_ARGUMENT("unused-definition-argument"),
    /** A component or layout was defined more than once; the later definition wins. */
    DUPLICATE_DEFINITION("duplicate-definition"),
    /** A project style value is not part of its enumeration; the default is kept. */
    INVALID_STYLE_VALUE("invalid-style-value"),
    /** A panel has more than one child or a split more than two; the surplus children get empty boxes. */
    EXTRA_CONTAINER_CHILDREN("extra-container-children"),
    // endregion

    // region General Errors
    /** The syntax tree input could not be read. */
    INVALID_INPUT("invalid-input");
    // endregion

    private final String key;

    CompilerErrorCode(String key) {
        this.key = key;
    }

    /**
     * @return The kebab-case key used in rendered messages.
     */
    public String key() {
        return key;
    }
}
