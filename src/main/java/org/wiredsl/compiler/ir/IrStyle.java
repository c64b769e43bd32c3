package org.wiredsl.compiler.ir;

import org.wiredsl.compiler.style.DensityLevel;

import java.util.Set;

/**
 * The resolved global style of a project.
 *
 * @param density    Density level.
 * @param spacing    Default spacing token.
 * @param radius     Corner radius token.
 * @param stroke     Stroke weight token.
 * @param font       Font size token.
 * @param background Optional background color, may be null.
 * @param theme      Optional theme name, may be null.
 * @param device     Optional device preset name, may be null.
 */
public record IrStyle(DensityLevel density, String spacing, String radius, String stroke, String font,
					  String background, String theme, String device) {

	public static final Set<String> SPACING_VALUES = Set.of("none", "xs", "sm", "md", "lg", "xl");
	public static final Set<String> RADIUS_VALUES = Set.of("none", "sm", "md", "lg", "full");
	public static final Set<String> STROKE_VALUES = Set.of("thin", "normal", "thick");
	public static final Set<String> FONT_VALUES = Set.of("sm", "base", "lg");

	/**
	 * @return The style every project starts from.
	 */
	public static IrStyle defaults() {
		return new IrStyle(DensityLevel.NORMAL, "md", "md", "normal", "base", null, null, null);
	}
}
