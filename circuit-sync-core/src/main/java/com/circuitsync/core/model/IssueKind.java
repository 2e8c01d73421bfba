package com.circuitsync.core.model;

/**
 * Kinds of issues reported by a run, with their fixed severity.
 */
public enum IssueKind {
    FORMAT_ERROR(Severity.ERROR),
    IDENTITY_CONFLICT(Severity.ERROR),
    INVALID_DESCRIPTION(Severity.ERROR),
    UNRESOLVED_REFERENCE(Severity.WARNING),
    PLACEMENT_EXHAUSTED(Severity.WARNING),
    PRESERVED_COMPONENT(Severity.INFO);

    private final Severity severity;

    IssueKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    /**
     * @return true when an issue of this kind aborts the run
     */
    public boolean isFatal() {
        return severity == Severity.ERROR;
    }
}
