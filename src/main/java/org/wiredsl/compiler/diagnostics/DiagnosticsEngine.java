package org.wiredsl.compiler.diagnostics;

import org.wiredsl.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) that occur
 * while a project is lowered and expanded.
 * <p>
 * Errors are aggregated here and thrown once at the end of the pass, so a single run
 * reports every problem instead of stopping at the first.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     */
    public void reportError(CompilerErrorCode code, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message));
    }

    /**
     * Reports a warning.
     *
     * @param code    The warning code.
     * @param message The warning message.
     */
    public void reportWarning(CompilerErrorCode code, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All errors in reporting order.
     */
    public List<Diagnostic> errors() {
        return ofType(Diagnostic.Type.ERROR);
    }

    /**
     * @return All warnings in reporting order.
     */
    public List<Diagnostic> warnings() {
        return ofType(Diagnostic.Type.WARNING);
    }

    /**
     * Removes all collected diagnostics.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    private List<Diagnostic> ofType(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).toList();
    }
}
