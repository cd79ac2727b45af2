package com.flowcanvas.core.geometry;

/**
 * A 2D point or offset.
 */
public record Point(double x, double y) {

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
