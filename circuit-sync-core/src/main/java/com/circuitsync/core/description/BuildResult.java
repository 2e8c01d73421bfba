package com.circuitsync.core.description;

import com.circuitsync.core.model.Circuit;
import com.circuitsync.core.model.SyncIssue;

import java.util.List;
import java.util.Objects;

/**
 * A model built from a description or a document, with the issues found on the way.
 *
 * @param circuit root circuit
 * @param issues non-fatal issues
 */
public record BuildResult(Circuit circuit, List<SyncIssue> issues) {
    public BuildResult {
        Objects.requireNonNull(circuit, "circuit must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
