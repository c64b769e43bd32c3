package org.wiredsl.compiler.style;

/**
 * Font size and line height used to estimate wrapped text height.
 *
 * @param fontSize   Font size in pixels.
 * @param lineHeight Line height as a multiple of the font size.
 */
public record TextMetrics(int fontSize, double lineHeight) {

    /** Average glyph width as a fraction of the font size. */
    public static final double CHAR_WIDTH_RATIO = 0.6;

    public static TextMetrics body(DensityLevel density) {
        switch (density != null ? density : DensityLevel.NORMAL) {
            case COMPACT:
                return new TextMetrics(12, 1.4);
            case COMFORTABLE:
                return new TextMetrics(16, 1.6);
            default:
                return new TextMetrics(14, 1.5);
        }
    }

    public static TextMetrics heading(DensityLevel density) {
        switch (density != null ? density : DensityLevel.NORMAL) {
            case COMPACT:
                return new TextMetrics(16, 1.25);
            case COMFORTABLE:
                return new TextMetrics(24, 1.25);
            default:
                return new TextMetrics(20, 1.25);
        }
    }

    /**
     * @return The pixel height of one line, rounded up.
     */
    public int lineHeightPx() {
        return (int) Math.ceil(fontSize * lineHeight);
    }
}
