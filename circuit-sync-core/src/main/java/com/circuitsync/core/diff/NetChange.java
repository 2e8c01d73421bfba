package com.circuitsync.core.diff;

import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.Net;

import java.util.List;
import java.util.Objects;

/**
 * Classification of one net. Endpoints are expressed in target keys: the keys the
 * owning components and instances carry in the written document.
 *
 * @param kind classification
 * @param current the document's net, null for ADD
 * @param desired the described net in target keys, null for REMOVE
 * @param addedEndpoints endpoints gained (UPDATE) or all endpoints (ADD)
 * @param removedEndpoints endpoints lost (UPDATE) or all endpoints (REMOVE)
 * @param relabel true when the name or the net class changes
 */
public record NetChange(
    ChangeKind kind,
    Net current,
    Net desired,
    List<Endpoint> addedEndpoints,
    List<Endpoint> removedEndpoints,
    boolean relabel
) implements Change {

    public NetChange {
        Objects.requireNonNull(kind, "kind must not be null");
        addedEndpoints = addedEndpoints == null ? List.of() : List.copyOf(addedEndpoints);
        removedEndpoints = removedEndpoints == null ? List.of() : List.copyOf(removedEndpoints);
    }

    /**
     * @return the net name after the run, or the removed net's name
     */
    @Override
    public String entity() {
        return desired != null ? desired.name() : current.name();
    }
}
