package com.circuitsync.core.model;

/**
 * Severity levels for issues recorded during a run.
 */
public enum Severity {
    /** Informational, no action needed. */
    INFO,

    /** The run succeeded but a result may be suboptimal. */
    WARNING,

    /** The run was aborted before any write. */
    ERROR
}
