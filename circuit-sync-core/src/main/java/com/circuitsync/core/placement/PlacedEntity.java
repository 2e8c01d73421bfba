package com.circuitsync.core.placement;

import com.circuitsync.core.model.Position;

import java.util.Objects;

/**
 * An entity that already has a position and only occupies space.
 *
 * @param key component or instance key
 * @param position anchor
 * @param extent bounding box around the anchor
 */
public record PlacedEntity(String key, Position position, Extent extent) {
    public PlacedEntity {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(extent, "extent must not be null");
    }
}
