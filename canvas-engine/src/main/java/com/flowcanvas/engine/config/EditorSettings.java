package com.flowcanvas.engine.config;

import com.flowcanvas.core.graph.DagLayout;
import com.flowcanvas.core.history.WorkflowHistory;

/**
 * Tunable editor values, bound from {@code canvas-editor.properties}.
 */
public record EditorSettings(
    double layerSpacing,
    double nodeSpacing,
    int historyCapacity,
    double fitPadding
) {
    public static final double DEFAULT_FIT_PADDING = 180.0;

    public EditorSettings {
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be >= 1");
        }
        if (!Double.isFinite(fitPadding) || fitPadding < 0.0) {
            throw new IllegalArgumentException("fitPadding must be a finite value >= 0");
        }
    }

    public static EditorSettings defaults() {
        return new EditorSettings(
            DagLayout.DEFAULT_LAYER_SPACING,
            DagLayout.DEFAULT_NODE_SPACING,
            WorkflowHistory.DEFAULT_CAPACITY,
            DEFAULT_FIT_PADDING
        );
    }

    /**
     * @throws IllegalArgumentException if a spacing is negative or not finite
     */
    public DagLayout layout() {
        return new DagLayout(layerSpacing, nodeSpacing);
    }
}
