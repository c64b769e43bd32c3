package org.wiredsl.compiler.ir;

import org.wiredsl.compiler.util.OrderedMaps;

import java.util.Map;

/**
 * A leaf component rendered natively by the renderer.
 */
public record IrComponentNode(String id, String componentType, Map<String, IrValue> props,
							  IrNodeStyle style, IrMeta meta) implements IrNode {

	public IrComponentNode {
		props = OrderedMaps.copyOf(props);
		style = style != null ? style : IrNodeStyle.empty();
		meta = meta != null ? meta : new IrMeta(null, null);
	}

	@Override
	public Map<String, IrValue> attributes() {
		return props;
	}
}
