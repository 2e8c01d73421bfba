package com.circuitsync.core.model;

/**
 * Electrical class of a net. Power nets are annotated with global labels.
 */
public enum NetClass {
    SIGNAL,
    POWER
}
