package com.circuitsync.core.placement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.Set;

/**
 * Set of occupied cells on a square grid.
 *
 * <p>Boxes are rasterized conservatively: every cell a box touches is occupied. A box
 * that fits into free cells therefore never overlaps anything marked before.
 */
public class OccupancyGrid {

    private final BigDecimal pitch;
    private final Set<Long> occupied = new HashSet<>();
    private int maxCellX = Integer.MIN_VALUE;
    private int minCellY = Integer.MAX_VALUE;

    public OccupancyGrid(BigDecimal pitch) {
        this.pitch = pitch;
    }

    public BigDecimal pitch() {
        return pitch;
    }

    /**
     * Cell index containing the given coordinate.
     */
    public int cellOf(BigDecimal coordinate) {
        return coordinate.divide(pitch, 0, RoundingMode.FLOOR).intValueExact();
    }

    /**
     * Coordinate of a cell's origin, an exact multiple of the pitch.
     */
    public BigDecimal coordinateOf(int cell) {
        return pitch.multiply(BigDecimal.valueOf(cell));
    }

    /**
     * Marks the box of an entity anchored at cell ({@code cx}, {@code cy}), grown by {@code margin}.
     */
    public void mark(int cx, int cy, Extent extent, BigDecimal margin) {
        mark(coordinateOf(cx), coordinateOf(cy), extent, margin);
    }

    /**
     * Marks the box of an entity anchored at an arbitrary point, grown by {@code margin}.
     */
    public void mark(BigDecimal x, BigDecimal y, Extent extent, BigDecimal margin) {
        int[] r = cells(x, y, extent, margin);
        for (int cx = r[0]; cx <= r[2]; cx++) {
            for (int cy = r[1]; cy <= r[3]; cy++) {
                occupied.add(pack(cx, cy));
            }
        }
        maxCellX = Math.max(maxCellX, r[2]);
        minCellY = Math.min(minCellY, r[1]);
    }

    /**
     * @return true when the box anchored at cell ({@code cx}, {@code cy}) touches no occupied cell
     */
    public boolean fits(int cx, int cy, Extent extent) {
        int[] r = cells(coordinateOf(cx), coordinateOf(cy), extent, BigDecimal.ZERO);
        for (int x = r[0]; x <= r[2]; x++) {
            for (int y = r[1]; y <= r[3]; y++) {
                if (occupied.contains(pack(x, y))) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return occupied.isEmpty();
    }

    /**
     * @return right-most occupied cell column, or {@link Integer#MIN_VALUE} when empty
     */
    public int maxCellX() {
        return maxCellX;
    }

    /**
     * @return top-most occupied cell row, or {@link Integer#MAX_VALUE} when empty
     */
    public int minCellY() {
        return minCellY;
    }

    /**
     * Left-most anchor column whose box starts strictly right of {@code column}.
     */
    public int anchorRightOf(int column, Extent extent) {
        int offset = extent.minX().divide(pitch, 0, RoundingMode.FLOOR).intValueExact();
        return column + 1 - offset;
    }

    private int[] cells(BigDecimal x, BigDecimal y, Extent extent, BigDecimal margin) {
        int x0 = x.add(extent.minX()).subtract(margin).divide(pitch, 0, RoundingMode.FLOOR).intValueExact();
        int y0 = y.add(extent.minY()).subtract(margin).divide(pitch, 0, RoundingMode.FLOOR).intValueExact();
        int x1 = x.add(extent.maxX()).add(margin).divide(pitch, 0, RoundingMode.CEILING).intValueExact();
        int y1 = y.add(extent.maxY()).add(margin).divide(pitch, 0, RoundingMode.CEILING).intValueExact();
        return new int[] {x0, y0, x1, y1};
    }

    private static long pack(int x, int y) {
        return ((long) x << 32) | (y & 0xFFFFFFFFL);
    }
}
