package org.wiredsl.compiler.ir;

import java.util.Map;

/**
 * A node of the flat IR graph. Nodes reference their children by id only.
 */
public sealed interface IrNode permits IrContainerNode, IrComponentNode {

	String id();

	IrNodeStyle style();

	IrMeta meta();

	/**
	 * @return Params of a container or props of a component.
	 */
	Map<String, IrValue> attributes();
}
