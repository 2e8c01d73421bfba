package com.circuitsync.core.diff;

/**
 * One classified entity of an {@link EditPlan}.
 */
public sealed interface Change permits ComponentChange, NetChange, InstanceChange {

    ChangeKind kind();

    /**
     * @return a human readable name of the entity, e.g. a reference or net name
     */
    String entity();
}
