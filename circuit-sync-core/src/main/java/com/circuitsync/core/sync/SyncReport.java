package com.circuitsync.core.sync;

import com.circuitsync.core.diff.ChangeKind;
import com.circuitsync.core.model.SyncIssue;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one synchronization run.
 *
 * @param success false when a fatal issue aborted the run; nothing was written then
 * @param dryRun true when the run only planned
 * @param components component change counts, all namespaces
 * @param nets net change counts, all namespaces
 * @param instances sub-circuit instance change counts, all namespaces
 * @param fragmentsWritten fragment files written, in write order
 * @param fragmentsDeleted fragment files deleted
 * @param issues every issue of the run
 */
@JsonPropertyOrder({"success", "dryRun", "components", "nets", "instances",
    "fragmentsWritten", "fragmentsDeleted", "issues"})
public record SyncReport(
    boolean success,
    boolean dryRun,
    ChangeCounts components,
    ChangeCounts nets,
    ChangeCounts instances,
    List<String> fragmentsWritten,
    List<String> fragmentsDeleted,
    List<SyncIssue> issues
) {
    public SyncReport {
        components = components == null ? ChangeCounts.NONE : components;
        nets = nets == null ? ChangeCounts.NONE : nets;
        instances = instances == null ? ChangeCounts.NONE : instances;
        fragmentsWritten = fragmentsWritten == null ? List.of() : List.copyOf(fragmentsWritten);
        fragmentsDeleted = fragmentsDeleted == null ? List.of() : List.copyOf(fragmentsDeleted);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Report of a run aborted by fatal issues.
     */
    public static SyncReport failed(boolean dryRun, List<SyncIssue> issues) {
        return new SyncReport(false, dryRun, null, null, null, null, null, issues);
    }

    /**
     * @return true when any entity was added, removed or updated
     */
    public boolean hasChanges() {
        return components.changed() + nets.changed() + instances.changed() > 0;
    }

    /**
     * Change counts of one entity kind.
     */
    @JsonPropertyOrder({"added", "removed", "updated", "kept"})
    public record ChangeCounts(int added, int removed, int updated, int kept) {

        public static final ChangeCounts NONE = new ChangeCounts(0, 0, 0, 0);

        public static ChangeCounts of(Map<ChangeKind, Integer> counts) {
            return new ChangeCounts(
                counts.getOrDefault(ChangeKind.ADD, 0),
                counts.getOrDefault(ChangeKind.REMOVE, 0),
                counts.getOrDefault(ChangeKind.UPDATE, 0),
                counts.getOrDefault(ChangeKind.KEEP, 0));
        }

        int changed() {
            return added + removed + updated;
        }
    }
}
