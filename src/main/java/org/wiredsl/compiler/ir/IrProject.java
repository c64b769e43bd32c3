package org.wiredsl.compiler.ir;

import org.wiredsl.compiler.util.OrderedMaps;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The composed project: resolved style, screens and the flat node map in creation order.
 */
public record IrProject(String id, String name, IrStyle style, Map<String, String> mocks,
						Map<String, String> colors, List<IrScreen> screens, Map<String, IrNode> nodes) {

	public IrProject {
		mocks = OrderedMaps.copyOf(mocks);
		colors = OrderedMaps.copyOf(colors);
		screens = screens != null ? List.copyOf(screens) : List.of();
		nodes = OrderedMaps.copyOf(nodes);
	}

	/**
	 * @param id A node id.
	 * @return The node, or empty if the id is unknown.
	 */
	public Optional<IrNode> node(String id) {
		return Optional.ofNullable(nodes.get(id));
	}
}
