package org.wiredsl.compiler.diagnostics;

import org.wiredsl.compiler.api.CompilerErrorCode;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced while composing a project.
 *
 * @param type    The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code    The stable error code of the diagnostic.
 * @param message The diagnostic message.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, code.key(), message);
    }
}
