package com.circuitsync.core.placement;

import com.circuitsync.core.model.Position;
import com.circuitsync.core.model.SyncIssue;

import java.util.List;
import java.util.Map;

/**
 * Positions assigned to requested entities.
 *
 * @param positions key to assigned anchor, one entry per request
 * @param issues placement warnings
 */
public record PlacementResult(Map<String, Position> positions, List<SyncIssue> issues) {
    public PlacementResult {
        positions = Map.copyOf(positions);
        issues = List.copyOf(issues);
    }
}
