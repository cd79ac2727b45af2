package com.flowcanvas.core.graph;

/**
 * Result of an auto-layout request. Positions are only written for {@link #APPLIED}.
 */
public enum LayoutOutcome {
    /**
     * Every node received a new position.
     */
    APPLIED,

    /**
     * The workflow has no nodes.
     */
    SKIPPED_EMPTY,

    /**
     * The connection graph contains a cycle; positions were left untouched.
     */
    SKIPPED_CYCLIC;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
