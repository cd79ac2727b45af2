package com.flowcanvas.core.model;

/**
 * Declared data type flowing through a node port.
 * Only used for advisory compatibility checks between connected nodes.
 */
public enum PortType {
    /**
     * Accepts or produces anything.
     */
    ANY,

    /**
     * Inbound request or message produced by an entry node.
     */
    EVENT,

    /**
     * Structured JSON value.
     */
    JSON,

    /**
     * Value read from keyed state.
     */
    STATE,

    /**
     * Promise or awakeable completion.
     */
    SIGNAL,

    /**
     * Accepts nothing. Entry nodes declare this as their input.
     */
    NONE;

    /**
     * Check whether an output of this type may feed the given input type.
     */
    public boolean canFeed(PortType input) {
        if (this == ANY || input == ANY) {
            return true;
        }
        if (input == NONE || this == NONE) {
            return false;
        }
        if (this == input) {
            return true;
        }
        return input == JSON && (this == EVENT || this == STATE);
    }
}
