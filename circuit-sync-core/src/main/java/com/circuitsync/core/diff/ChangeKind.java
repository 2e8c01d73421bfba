package com.circuitsync.core.diff;

/**
 * Classification of an entity by the diff.
 */
public enum ChangeKind {
    /** Matched, nothing to change. Never touched by placement or annotation edits. */
    KEEP,
    /** Matched, attributes differ. */
    UPDATE,
    /** Only in the desired model. */
    ADD,
    /** Only in the current model. */
    REMOVE
}
