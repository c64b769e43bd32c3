package org.wiredsl.compiler.backend.layout;

/**
 * The absolute rectangle of one node, relative to its screen's origin.
 * Boxes stay mutable while a screen is laid out because container heights and child
 * positions are corrected after the first pass.
 */
public final class LayoutBox {

    private double x;
    private double y;
    private double width;
    private double height;

    public LayoutBox(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    void setY(double y) {
        this.y = y;
    }

    void setHeight(double height) {
        this.height = height;
    }

    /**
     * @return The y coordinate of the bottom edge.
     */
    public double bottom() {
        return y + height;
    }

    /**
     * @return The x coordinate of the right edge.
     */
    public double right() {
        return x + width;
    }

    @Override
    public String toString() {
        return String.format("{x=%s, y=%s, width=%s, height=%s}", x, y, width, height);
    }
}
