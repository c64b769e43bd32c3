package org.wiredsl.compiler.backend.layout;

import org.wiredsl.compiler.backend.layout.features.CardLayoutHandler;
import org.wiredsl.compiler.backend.layout.features.GridLayoutHandler;
import org.wiredsl.compiler.backend.layout.features.PanelLayoutHandler;
import org.wiredsl.compiler.backend.layout.features.SplitLayoutHandler;
import org.wiredsl.compiler.backend.layout.features.StackLayoutHandler;
import org.wiredsl.compiler.ir.ContainerType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for container layout handlers, keyed by container type.
 */
public final class ContainerLayoutRegistry {

	private final Map<ContainerType, IContainerLayoutHandler> handlers = new EnumMap<>(ContainerType.class);
	private final IContainerLayoutHandler defaultHandler;

	/**
	 * Constructs a new container layout registry.
	 * @param defaultHandler The handler to use when no specific handler is registered.
	 */
	public ContainerLayoutRegistry(IContainerLayoutHandler defaultHandler) {
		this.defaultHandler = defaultHandler;
	}

	/**
	 * Registers a handler, replacing any previous one for the same type.
	 * @param type The container type.
	 * @param handler The handler for that type.
	 */
	public void register(ContainerType type, IContainerLayoutHandler handler) {
		handlers.put(type, handler);
	}

	/**
	 * @param type The container type.
	 * @return An optional containing the handler, or empty if not registered.
	 */
	public Optional<IContainerLayoutHandler> get(ContainerType type) {
		return Optional.ofNullable(handlers.get(type));
	}

	/**
	 * @param type The container type.
	 * @return The registered handler, or the default handler.
	 */
	public IContainerLayoutHandler resolve(ContainerType type) {
		return get(type).orElse(defaultHandler);
	}

	/**
	 * Initializes a new registry with the built-in container handlers. Stack is the fallback.
	 * @return A new registry with default handlers.
	 */
	public static ContainerLayoutRegistry initializeWithDefaults() {
		StackLayoutHandler stack = new StackLayoutHandler();
		ContainerLayoutRegistry reg = new ContainerLayoutRegistry(stack);
		reg.register(ContainerType.STACK, stack);
		reg.register(ContainerType.GRID, new GridLayoutHandler());
		reg.register(ContainerType.SPLIT, new SplitLayoutHandler());
		reg.register(ContainerType.PANEL, new PanelLayoutHandler());
		reg.register(ContainerType.CARD, new CardLayoutHandler());
		return reg;
	}
}
