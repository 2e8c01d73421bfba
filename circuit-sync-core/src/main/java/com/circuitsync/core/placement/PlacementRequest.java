package com.circuitsync.core.placement;

import java.util.List;
import java.util.Objects;

/**
 * An added entity that needs a position.
 *
 * @param key component or instance key
 * @param label reference label or instance name, defines the processing order
 * @param extent bounding box around the future anchor
 * @param neighbours keys of electrically connected entities, nearest first
 */
public record PlacementRequest(String key, String label, Extent extent, List<String> neighbours) {
    public PlacementRequest {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(extent, "extent must not be null");
        neighbours = neighbours == null ? List.of() : List.copyOf(neighbours);
    }
}
