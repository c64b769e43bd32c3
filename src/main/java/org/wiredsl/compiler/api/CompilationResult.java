package org.wiredsl.compiler.api;

import org.wiredsl.compiler.backend.layout.PositionMap;
import org.wiredsl.compiler.diagnostics.Diagnostic;
import org.wiredsl.compiler.ir.IrContract;

import java.util.List;

/**
 * Output of a successful compilation.
 *
 * @param ir       The validated IR contract.
 * @param layout   The box of every laid-out node.
 * @param warnings Warnings collected while composing the IR, in reporting order.
 */
public record CompilationResult(IrContract ir, PositionMap layout, List<Diagnostic> warnings) {

    public CompilationResult {
        warnings = List.copyOf(warnings);
    }
}
