package org.wiredsl.compiler.ir;

/**
 * Node metadata. Both fields may be null.
 *
 * @param source "cell" for containers lowered from grid cells.
 * @param nodeId The source-map id of the originating syntax tree node.
 */
public record IrMeta(String source, String nodeId) {

	public static final String SOURCE_CELL = "cell";

	public boolean isCell() {
		return SOURCE_CELL.equals(source);
	}
}
