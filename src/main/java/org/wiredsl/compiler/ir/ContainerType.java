package org.wiredsl.compiler.ir;

import java.util.Optional;

/**
 * Built-in container strategies understood by the layout engine.
 */
public enum ContainerType {
	STACK("stack", Integer.MAX_VALUE),
	GRID("grid", Integer.MAX_VALUE),
	SPLIT("split", 2),
	PANEL("panel", 1),
	CARD("card", Integer.MAX_VALUE);

	private final String token;
	private final int maxChildren;

	ContainerType(String token, int maxChildren) {
		this.token = token;
		this.maxChildren = maxChildren;
	}

	public String token() {
		return token;
	}

	/**
	 * @return How many children the layout engine places; later children are collapsed to empty boxes.
	 */
	public int maxChildren() {
		return maxChildren;
	}

	/**
	 * @param name A layout type name as written in the DSL.
	 * @return The container type, or empty if the name is not a built-in container.
	 */
	public static Optional<ContainerType> fromName(String name) {
		for (ContainerType type : values()) {
			if (type.token.equals(name)) return Optional.of(type);
		}
		return Optional.empty();
	}
}
