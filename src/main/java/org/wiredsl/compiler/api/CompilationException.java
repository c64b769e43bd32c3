package org.wiredsl.compiler.api;

import org.wiredsl.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during composition.
 * <p>
 * It is part of the public API and carries the primary error code together with every
 * diagnostic collected in the failing run.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode code;
    private final transient List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception.
     * @param code The primary error code.
     * @param message The detail message.
     * @param diagnostics All diagnostics collected in the failing run.
     */
    public CompilationException(CompilerErrorCode code, String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.code = code;
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param code The primary error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.diagnostics = List.of();
    }

    /**
     * @return The primary error code.
     */
    public CompilerErrorCode getCode() {
        return code;
    }

    /**
     * @return The diagnostics collected in the failing run, possibly empty.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
