package org.wiredsl.compiler.ir;

/**
 * Per-node style. Every field may be null when not set.
 *
 * @param padding    Spacing token for inner padding.
 * @param gap        Spacing token between children.
 * @param align      left, center, right, justify, start or end.
 * @param justify    start, center, end, spaceBetween, spaceAround or stretch.
 * @param background Background color token.
 */
public record IrNodeStyle(String padding, String gap, String align, String justify, String background) {

	private static final IrNodeStyle EMPTY = new IrNodeStyle(null, null, null, null, null);

	public static IrNodeStyle empty() {
		return EMPTY;
	}
}
