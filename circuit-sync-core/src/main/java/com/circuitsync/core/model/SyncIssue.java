package com.circuitsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * An issue recorded during a synchronization run.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SyncIssue issue = SyncIssue.of(
 *     IssueKind.UNRESOLVED_REFERENCE,
 *     "U1",
 *     "Symbol 'MCU:Unknown' not found, using placeholder pins"
 * );
 * }</pre>
 *
 * @param kind issue kind
 * @param severity severity, taken from the kind
 * @param entity the affected entity (reference, net, instance or fragment name)
 * @param message human-readable description
 */
public record SyncIssue(IssueKind kind, Severity severity, String entity, String message) {

    public SyncIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (severity == null) {
            severity = kind.severity();
        }
    }

    public static SyncIssue of(IssueKind kind, String entity, String message) {
        return new SyncIssue(kind, kind.severity(), entity, message);
    }

    @JsonIgnore
    public boolean isFatal() {
        return severity == Severity.ERROR;
    }
}
