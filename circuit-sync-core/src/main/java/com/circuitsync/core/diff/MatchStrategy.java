package com.circuitsync.core.diff;

import com.circuitsync.core.model.Component;

import java.util.List;

/**
 * Pairs current and desired components that have not been matched yet.
 *
 * <p>Strategies run in a fixed order; each sees only what earlier strategies left over.
 */
public interface MatchStrategy {

    /**
     * @return name recorded on the changes this strategy produces
     */
    String name();

    /**
     * @param current unmatched components of the document
     * @param desired unmatched components of the description
     * @return disjoint pairs
     */
    List<Match> match(List<Component> current, List<Component> desired);

    /**
     * A pairing of one current and one desired component.
     */
    record Match(Component current, Component desired) {
    }
}
