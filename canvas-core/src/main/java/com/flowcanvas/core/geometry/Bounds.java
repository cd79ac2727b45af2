package com.flowcanvas.core.geometry;

import java.util.Collection;
import java.util.Optional;

/**
 * Axis-aligned box given as (minX, minY, maxX, maxY).
 */
public record Bounds(double minX, double minY, double maxX, double maxY) {

    /**
     * Bounding box of node footprints whose top-left corners are at the given positions.
     * Empty when there are no positions.
     */
    public static Optional<Bounds> ofNodes(Collection<Point> positions, double nodeWidth, double nodeHeight) {
        if (positions.isEmpty()) {
            return Optional.empty();
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point p : positions) {
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x() + nodeWidth);
            maxY = Math.max(maxY, p.y() + nodeHeight);
        }
        return Optional.of(new Bounds(minX, minY, maxX, maxY));
    }

    public Point center() {
        return new Point((minX + maxX) / 2.0, (minY + maxY) / 2.0);
    }

    public Size size() {
        return new Size(maxX - minX, maxY - minY);
    }
}
