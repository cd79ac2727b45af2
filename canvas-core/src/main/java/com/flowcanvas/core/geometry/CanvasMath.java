package com.flowcanvas.core.geometry;

import com.flowcanvas.core.model.Viewport;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Stateless viewport and drag math for the canvas.
 * Every function degrades to returning its input unchanged (or empty) on non-finite arguments,
 * so callers never write NaN or infinity into the model.
 */
public final class CanvasMath {

    public static final double NODE_WIDTH = 220.0;
    public static final double NODE_HEIGHT = 68.0;

    public static final double MIN_ZOOM = 0.1;
    public static final double MAX_ZOOM = 5.0;

    public static final double FIT_MIN_ZOOM = 0.15;
    public static final double FIT_MAX_ZOOM = 1.5;

    public static final double SNAP_GRID = 10.0;
    public static final double POSITION_LIMIT = 100_000.0;

    /**
     * Two positions closer than this on both axes are treated as overlapping.
     */
    public static final double OVERLAP_TOLERANCE = 10.0;

    private CanvasMath() {
    }

    /**
     * Apply a relative zoom step, clamped to [{@value #MIN_ZOOM}, {@value #MAX_ZOOM}].
     *
     * @param delta relative change, e.g. 0.1 for +10%
     * @param currentZoom zoom before the step
     * @return the new zoom; the clamped current zoom if delta is not finite,
     *         1.0 if the current zoom is not a usable value
     */
    public static double calculateZoomDelta(double delta, double currentZoom) {
        if (!Double.isFinite(delta)) {
            return clamp(currentZoom, MIN_ZOOM, MAX_ZOOM);
        }
        if (!Double.isFinite(currentZoom) || currentZoom <= 0.0) {
            return 1.0;
        }
        return clamp(currentZoom * (1.0 + delta), MIN_ZOOM, MAX_ZOOM);
    }

    /**
     * Compute the pan offset that keeps the screen point (centerX, centerY) fixed while
     * the zoom changes from oldZoom to newZoom.
     */
    public static Point calculatePanOffset(
            double viewportX,
            double viewportY,
            double centerX,
            double centerY,
            double oldZoom,
            double newZoom) {
        Point unchanged = new Point(viewportX, viewportY);
        if (!allFinite(viewportX, viewportY, centerX, centerY, oldZoom, newZoom) || oldZoom <= 0.0) {
            return unchanged;
        }

        double factor = newZoom / oldZoom;
        if (!Double.isFinite(factor)) {
            return unchanged;
        }

        double newX = centerX - (centerX - viewportX) * factor;
        double newY = centerY - (centerY - viewportY) * factor;
        if (!Double.isFinite(newX) || !Double.isFinite(newY)) {
            return unchanged;
        }
        return new Point(newX, newY);
    }

    /**
     * Compute a viewport that shows every node footprint centred in a viewport of the given size.
     *
     * @return empty if there are no nodes, the viewport size is not positive, the padding is negative,
     *         or any input is not finite
     */
    public static Optional<Viewport> calculateFitView(
            Collection<Point> nodePositions,
            double viewportWidth,
            double viewportHeight,
            double padding) {
        if (nodePositions.isEmpty()) {
            return Optional.empty();
        }
        if (!allFinite(viewportWidth, viewportHeight, padding)
                || viewportWidth <= 0.0
                || viewportHeight <= 0.0
                || padding < 0.0) {
            return Optional.empty();
        }
        if (nodePositions.stream().anyMatch(p -> !p.isFinite())) {
            return Optional.empty();
        }

        return Bounds.ofNodes(nodePositions, NODE_WIDTH, NODE_HEIGHT).map(bounds -> {
            Size size = bounds.size();
            double scaleX = (viewportWidth - padding) / Math.max(size.width(), 1.0);
            double scaleY = (viewportHeight - padding) / Math.max(size.height(), 1.0);
            double zoom = clamp(Math.min(scaleX, scaleY), FIT_MIN_ZOOM, FIT_MAX_ZOOM);

            Point center = bounds.center();
            return new Viewport(
                viewportWidth / 2.0 - center.x() * zoom,
                viewportHeight / 2.0 - center.y() * zoom,
                zoom
            );
        });
    }

    /**
     * Nudge (desiredX, desiredY) by +step on both axes until no existing position lies within
     * {@value #OVERLAP_TOLERANCE} units of it on both axes.
     * A non-positive or non-finite step returns the desired position unchanged. Stops early if a
     * nudge no longer moves the candidate, i.e. the step is below the precision of the coordinates.
     */
    public static Point findSafePosition(List<Point> existing, double desiredX, double desiredY, double step) {
        if (!Double.isFinite(step) || step <= 0.0 || !Double.isFinite(desiredX) || !Double.isFinite(desiredY)) {
            return new Point(desiredX, desiredY);
        }

        double currentX = desiredX;
        double currentY = desiredY;
        while (overlapsAny(existing, currentX, currentY)) {
            double nextX = currentX + step;
            double nextY = currentY + step;
            if (nextX == currentX && nextY == currentY) {
                break;
            }
            currentX = nextX;
            currentY = nextY;
        }
        return new Point(currentX, currentY);
    }

    /**
     * Clamp a coordinate to +/-{@value #POSITION_LIMIT}.
     */
    public static double clampPosition(double value) {
        return clamp(value, -POSITION_LIMIT, POSITION_LIMIT);
    }

    /**
     * Apply a drag delta and snap to the {@value #SNAP_GRID}-unit grid:
     * {@code round((x + dx) / 10) * 10} per axis, clamped to +/-{@value #POSITION_LIMIT}.
     * Returns (x, y) unchanged if any input is not finite.
     */
    public static Point updateNodePosition(double x, double y, double dx, double dy) {
        if (!allFinite(x, y, dx, dy)) {
            return new Point(x, y);
        }
        double newX = snap(x + dx);
        double newY = snap(y + dy);
        return new Point(clampPosition(newX), clampPosition(newY));
    }

    /**
     * Centre of a box given as (minX, minY, maxX, maxY).
     */
    public static Point rectCenter(Bounds rect) {
        return rect.center();
    }

    /**
     * Size of a box given as (minX, minY, maxX, maxY).
     */
    public static Size rectSize(Bounds rect) {
        return rect.size();
    }

    // Halves round away from zero so that -5 snaps to -10 the same way 5 snaps to 10.
    static double snap(double value) {
        double cells = value / SNAP_GRID;
        return Math.signum(cells) * Math.floor(Math.abs(cells) + 0.5) * SNAP_GRID + 0.0;
    }

    private static boolean overlapsAny(List<Point> existing, double x, double y) {
        return existing.stream().anyMatch(p ->
            Math.abs(p.x() - x) < OVERLAP_TOLERANCE && Math.abs(p.y() - y) < OVERLAP_TOLERANCE);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static boolean allFinite(double... values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
