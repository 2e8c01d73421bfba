package com.circuitsync.core.diff;

import com.circuitsync.core.model.SubcircuitInstance;

import java.util.Objects;

/**
 * Classification of one sub-circuit instance, with the plan for its body.
 *
 * @param kind classification of the instance itself (name and ports)
 * @param current the document's instance, null for ADD
 * @param desired the described instance, null for REMOVE
 * @param body plan for the instance's namespace; for REMOVE it lists every body entity as
 *     REMOVE and is reported but not applied
 */
public record InstanceChange(
    ChangeKind kind,
    SubcircuitInstance current,
    SubcircuitInstance desired,
    EditPlan body
) implements Change {

    public InstanceChange {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public String entity() {
        return desired != null ? desired.name() : current.name();
    }
}
