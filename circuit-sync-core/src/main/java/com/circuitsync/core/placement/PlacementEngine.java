package com.circuitsync.core.placement;

import com.circuitsync.core.config.SyncConfig.PlacementSettings;
import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.model.SyncIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns positions to added entities without moving anything else.
 *
 * <p>The grid is seeded with every existing box grown by the clearance. Requests are
 * handled in label order. A request with placed neighbours searches square rings around
 * its first neighbour; otherwise rows are swept from the sheet origin. Both searches stop
 * after the configured number of rings or rows, and the entity then goes one cell right
 * of everything placed so far. Placement never fails.
 */
public class PlacementEngine {

    private static final Logger log = LoggerFactory.getLogger(PlacementEngine.class);

    private final PlacementSettings settings;

    public PlacementEngine(PlacementSettings settings) {
        this.settings = settings;
    }

    /**
     * @param existing entities that keep their position
     * @param requests added entities
     * @return one position per request plus any exhaustion warnings
     */
    public PlacementResult place(List<PlacedEntity> existing, List<PlacementRequest> requests) {
        OccupancyGrid grid = new OccupancyGrid(settings.grid());
        Map<String, Position> anchors = new HashMap<>();
        for (PlacedEntity entity : existing) {
            grid.mark(entity.position().x(), entity.position().y(), entity.extent(), settings.clearance());
            anchors.put(entity.key(), entity.position());
        }

        List<PlacementRequest> ordered = new ArrayList<>(requests);
        ordered.sort(Comparator.comparing(PlacementRequest::label).thenComparing(PlacementRequest::key));

        Map<String, Position> positions = new LinkedHashMap<>();
        List<SyncIssue> issues = new ArrayList<>();
        for (PlacementRequest request : ordered) {
            int[] cell = null;
            Position neighbour = request.neighbours().stream()
                .map(anchors::get)
                .filter(p -> p != null)
                .findFirst()
                .orElse(null);
            if (neighbour != null) {
                cell = spiral(grid, grid.cellOf(neighbour.x()), grid.cellOf(neighbour.y()), request.extent());
            }
            if (cell == null) {
                cell = sweep(grid, request.extent());
            }
            if (cell == null) {
                cell = fallback(grid, request.extent());
                issues.add(SyncIssue.of(IssueKind.PLACEMENT_EXHAUSTED, request.label(),
                    "No free slot within " + settings.searchLimit() + " grid steps, placed beyond the occupied area"));
                log.warn("Placement search exhausted for {}", request.label());
            }

            grid.mark(cell[0], cell[1], request.extent(), settings.clearance());
            Position position = Position.at(grid.coordinateOf(cell[0]), grid.coordinateOf(cell[1]));
            anchors.put(request.key(), position);
            positions.put(request.key(), position);
            log.debug("Placed {} at ({}, {})", request.label(), position.x(), position.y());
        }
        return new PlacementResult(positions, issues);
    }

    private int[] spiral(OccupancyGrid grid, int cx, int cy, Extent extent) {
        if (grid.fits(cx, cy, extent)) {
            return new int[] {cx, cy};
        }
        for (int ring = 1; ring <= settings.searchLimit(); ring++) {
            // right edge, bottom edge, left edge, top edge
            for (int d = -ring + 1; d <= ring; d++) {
                if (grid.fits(cx + ring, cy + d, extent)) {
                    return new int[] {cx + ring, cy + d};
                }
            }
            for (int d = ring - 1; d >= -ring; d--) {
                if (grid.fits(cx + d, cy + ring, extent)) {
                    return new int[] {cx + d, cy + ring};
                }
            }
            for (int d = ring - 1; d >= -ring; d--) {
                if (grid.fits(cx - ring, cy + d, extent)) {
                    return new int[] {cx - ring, cy + d};
                }
            }
            for (int d = -ring + 1; d <= ring; d++) {
                if (grid.fits(cx + d, cy - ring, extent)) {
                    return new int[] {cx + d, cy - ring};
                }
            }
        }
        return null;
    }

    private int[] sweep(OccupancyGrid grid, Extent extent) {
        int startX = grid.cellOf(settings.originX());
        int startY = grid.cellOf(settings.originY());
        int columns = settings.sweepWidth().divide(settings.grid(), 0, RoundingMode.FLOOR).intValueExact();
        for (int row = 0; row < settings.searchLimit(); row++) {
            for (int column = 0; column <= columns; column++) {
                if (grid.fits(startX + column, startY + row, extent)) {
                    return new int[] {startX + column, startY + row};
                }
            }
        }
        return null;
    }

    private int[] fallback(OccupancyGrid grid, Extent extent) {
        int y = grid.cellOf(settings.originY());
        if (grid.isEmpty()) {
            return new int[] {grid.cellOf(settings.originX()), y};
        }
        int top = Math.min(y, grid.minCellY());
        int offsetY = extent.minY().divide(settings.grid(), 0, RoundingMode.FLOOR).intValueExact();
        return new int[] {grid.anchorRightOf(grid.maxCellX(), extent), top - offsetY};
    }
}
