package org.wiredsl.compiler.ir;

import org.wiredsl.compiler.util.OrderedMaps;

import java.util.List;
import java.util.Map;

/**
 * A container node laid out by one of the built-in container strategies.
 */
public record IrContainerNode(String id, ContainerType containerType, Map<String, IrValue> params,
							  List<NodeRef> children, IrNodeStyle style, IrMeta meta) implements IrNode {

	public IrContainerNode {
		params = OrderedMaps.copyOf(params);
		children = children != null ? List.copyOf(children) : List.of();
		style = style != null ? style : IrNodeStyle.empty();
		meta = meta != null ? meta : new IrMeta(null, null);
	}

	@Override
	public Map<String, IrValue> attributes() {
		return params;
	}

	/**
	 * @return {@code true} if this container was lowered from a grid cell.
	 */
	public boolean isCell() {
		return meta.isCell();
	}
}
