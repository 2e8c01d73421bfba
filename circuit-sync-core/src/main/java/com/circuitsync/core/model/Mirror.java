package com.circuitsync.core.model;

/**
 * Mirror state of a placed component.
 */
public enum Mirror {
    NONE,
    /** Mirrored around the x axis (y values flipped). */
    X,
    /** Mirrored around the y axis (x values flipped). */
    Y
}
