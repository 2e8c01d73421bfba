package com.circuitsync.core.model;

import java.util.Objects;

/**
 * Named connection point through which a sub-circuit's internal net reaches its parent.
 *
 * @param name port name, shared by the child's hierarchical label and the parent's sheet pin
 * @param internalNet name of the net inside the sub-circuit carrying this port
 */
public record BoundaryPort(String name, String internalNet) {
    public BoundaryPort {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(internalNet, "internalNet must not be null");
    }
}
