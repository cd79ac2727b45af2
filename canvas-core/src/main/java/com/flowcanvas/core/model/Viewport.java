package com.flowcanvas.core.model;

import com.flowcanvas.core.geometry.Point;

/**
 * Affine transform from canvas (model) space to screen space:
 * {@code screen = model * zoom + pan}.
 */
public record Viewport(double x, double y, double zoom) {

    /**
     * Identity transform: no pan, zoom 1.
     */
    public static Viewport initial() {
        return new Viewport(0.0, 0.0, 1.0);
    }

    /**
     * Map a model-space point to screen space.
     */
    public Point toScreen(Point model) {
        return new Point(model.x() * zoom + x, model.y() * zoom + y);
    }

    /**
     * Map a screen-space point back to model space.
     */
    public Point toModel(Point screen) {
        return new Point((screen.x() - x) / zoom, (screen.y() - y) / zoom);
    }

    public Viewport withOffset(double newX, double newY) {
        return new Viewport(newX, newY, zoom);
    }
}
