package org.wiredsl.compiler.backend.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wiredsl.compiler.ir.IrContract;
import org.wiredsl.compiler.ir.IrProject;
import org.wiredsl.compiler.ir.IrScreen;

/**
 * Computes the absolute box of every node of an IR contract.
 * <p>
 * Each screen root is placed at the origin with the screen's viewport and walked depth first.
 * Layout never rejects a valid contract; a reference to a missing node is skipped.
 */
public final class LayoutEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutOptions options;
    private final ContainerLayoutRegistry registry;

    public LayoutEngine() {
        this(LayoutOptions.defaults());
    }

    public LayoutEngine(LayoutOptions options) {
        this(options, ContainerLayoutRegistry.initializeWithDefaults());
    }

    /**
     * @param options  Layout constants.
     * @param registry Handlers per container type.
     */
    public LayoutEngine(LayoutOptions options, ContainerLayoutRegistry registry) {
        this.options = options;
        this.registry = registry;
    }

    /**
     * Lays out all screens of the contract.
     * @param contract The IR contract.
     * @return The box of every placed node.
     */
    public PositionMap calculate(IrContract contract) {
        long start = System.nanoTime();
        IrProject project = contract.project();
        LayoutContext ctx = new LayoutContext(project.nodes(), project.style(), options, registry);

        for (IrScreen screen : project.screens()) {
            ctx.place(screen.root().ref(), 0, 0, screen.viewport().width(), screen.viewport().height(), null);
        }

        PositionMap result = ctx.toPositionMap();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Laid out {} of {} nodes across {} screens in {} ms", result.size(), project.nodes().size(),
                    project.screens().size(), (System.nanoTime() - start) / 1_000_000);
        }
        return result;
    }
}
