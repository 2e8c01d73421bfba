package com.circuitsync.core.diff;

import com.circuitsync.core.model.Component;

import java.util.Objects;

/**
 * Classification of one component.
 *
 * @param kind classification
 * @param current the document's component, null for ADD
 * @param desired the described component, null for REMOVE and for preserved components
 * @param patch attribute delta, empty unless UPDATE
 * @param matchedBy name of the strategy that paired the two, null for ADD and REMOVE
 */
public record ComponentChange(
    ChangeKind kind,
    Component current,
    Component desired,
    PropertyPatch patch,
    String matchedBy
) implements Change {

    public ComponentChange {
        Objects.requireNonNull(kind, "kind must not be null");
        if (patch == null) {
            patch = PropertyPatch.empty();
        }
    }

    /**
     * @return true for a component kept only because user components are preserved
     */
    public boolean preserved() {
        return kind == ChangeKind.KEEP && desired == null;
    }

    @Override
    public String entity() {
        return desired != null ? desired.reference() : current.reference();
    }
}
