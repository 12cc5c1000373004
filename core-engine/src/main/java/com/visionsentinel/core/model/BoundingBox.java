package com.visionsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Axis-aligned bounding box in pixel coordinates ({@code x1,y1} top-left,
 * {@code x2,y2} bottom-right).
 *
 * @since 1.0.0
 */
public final class BoundingBox implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    public BoundingBox(double x1, double y1, double x2, double y2) {
        if (x2 < x1 || y2 < y1) {
            throw new IllegalArgumentException(
                    "Invalid box [" + x1 + ", " + y1 + ", " + x2 + ", " + y2 + "]");
        }
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    /**
     * Divide every coordinate by {@code scale}; used to map a box found on a
     * downscaled frame back onto the original one.
     */
    public BoundingBox unscale(double scale) {
        if (scale <= 0) {
            throw new IllegalArgumentException("scale must be > 0, got: " + scale);
        }
        return new BoundingBox(x1 / scale, y1 / scale, x2 / scale, y2 / scale);
    }

    /**
     * Clamp the box into {@code [0, width] x [0, height]}.
     */
    public BoundingBox clamp(int width, int height) {
        return new BoundingBox(
                clamp(x1, width), clamp(y1, height),
                clamp(x2, width), clamp(y2, height));
    }

    public boolean contains(double x, double y) {
        return x >= x1 && x <= x2 && y >= y1 && y <= y2;
    }

    public double getX1() {
        return x1;
    }

    public double getY1() {
        return y1;
    }

    public double getX2() {
        return x2;
    }

    public double getY2() {
        return y2;
    }

    public double getWidth() {
        return x2 - x1;
    }

    public double getHeight() {
        return y2 - y1;
    }

    public double getCenterX() {
        return (x1 + x2) / 2.0;
    }

    public double getCenterY() {
        return (y1 + y2) / 2.0;
    }

    public double getArea() {
        return getWidth() * getHeight();
    }

    public double[] toArray() {
        return new double[] { x1, y1, x2, y2 };
    }

    private static double clamp(double v, int max) {
        return Math.max(0, Math.min(v, max));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BoundingBox that))
            return false;
        return Double.compare(x1, that.x1) == 0
                && Double.compare(y1, that.y1) == 0
                && Double.compare(x2, that.x2) == 0
                && Double.compare(y2, that.y2) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x1, y1, x2, y2);
    }

    @Override
    public String toString() {
        return "[" + x1 + ", " + y1 + ", " + x2 + ", " + y2 + "]";
    }
}
