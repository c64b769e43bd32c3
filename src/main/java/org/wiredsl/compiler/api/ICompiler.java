package org.wiredsl.compiler.api;

import org.wiredsl.compiler.frontend.ast.ProjectNode;
import org.wiredsl.compiler.frontend.ast.SyntaxTreeReader;

import java.nio.file.Path;

/**
 * Defines the public interface of the Wire DSL compiler backend.
 */
public interface ICompiler {

    /**
     * Composes the IR of a parsed project and lays out every screen.
     *
     * @param project The parsed project.
     * @return The IR contract, the position of every node and the warnings of the run.
     * @throws CompilationException if composition fails with errors.
     */
    CompilationResult compile(ProjectNode project) throws CompilationException;

    /**
     * Compiles a project from its JSON syntax tree.
     * @param syntaxTree Path of the JSON document produced by the parser.
     * @return The compilation result.
     * @throws CompilationException if the document cannot be read or composition fails.
     */
    default CompilationResult compile(Path syntaxTree) throws CompilationException {
        return compile(new SyntaxTreeReader().read(syntaxTree));
    }
}
