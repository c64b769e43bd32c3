package org.wiredsl.compiler;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wiredsl.compiler.api.CompilationException;
import org.wiredsl.compiler.api.CompilationResult;
import org.wiredsl.compiler.api.ICompiler;
import org.wiredsl.compiler.backend.layout.LayoutEngine;
import org.wiredsl.compiler.backend.layout.PositionMap;
import org.wiredsl.compiler.diagnostics.DiagnosticsEngine;
import org.wiredsl.compiler.frontend.ast.ProjectNode;
import org.wiredsl.compiler.frontend.irgen.IrConverterRegistry;
import org.wiredsl.compiler.frontend.irgen.IrGenerator;
import org.wiredsl.compiler.ir.IrContract;
import org.wiredsl.config.CompilerSettings;
import org.wiredsl.config.ConfigLoader;
import org.wiredsl.config.LoggingConfigurator;

/**
 * The main compiler implementation. Runs IR generation followed by layout.
 * <p>
 * Every call builds a fresh generator and engine, so one instance may be shared between threads.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerSettings settings;

    /**
     * Creates a compiler configured from {@code reference.conf}, {@code wiredsl.conf} and system properties.
     * The first instance also applies the configured logging levels.
     */
    public Compiler() {
        this(configure(ConfigLoader.load()));
    }

    public Compiler(CompilerSettings settings) {
        this.settings = settings;
    }

    private static CompilerSettings configure(Config config) {
        LoggingConfigurator.configure(config);
        return CompilerSettings.fromConfig(config);
    }

    @Override
    public CompilationResult compile(ProjectNode project) throws CompilationException {
        // Phase 1: IR generation
        IrGenerator generator = new IrGenerator(new DiagnosticsEngine(), IrConverterRegistry.initializeWithDefaults(),
            settings.defaultDevice());
        IrContract contract = generator.generate(project);

        // Phase 2: Layout
        PositionMap positions = new LayoutEngine(settings.layoutOptions()).calculate(contract);

        LOG.info("Compiled '{}': {} screens, {} nodes, {} warnings", project.name(), contract.project().screens().size(),
            positions.size(), generator.getWarnings().size());
        return new CompilationResult(contract, positions, generator.getWarnings());
    }
}
