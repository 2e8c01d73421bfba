package com.circuitsync.core.placement;

import com.circuitsync.core.model.Pin;
import com.circuitsync.core.model.Position;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Bounding box relative to an anchor point, in sheet millimetres (y axis down).
 *
 * @param minX left edge offset
 * @param minY top edge offset
 * @param maxX right edge offset
 * @param maxY bottom edge offset
 */
public record Extent(BigDecimal minX, BigDecimal minY, BigDecimal maxX, BigDecimal maxY) {

    /** Smallest box side of a component. */
    public static final BigDecimal MINIMUM_SIDE = new BigDecimal("5.08");

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public Extent {
        Objects.requireNonNull(minX, "minX must not be null");
        Objects.requireNonNull(minY, "minY must not be null");
        Objects.requireNonNull(maxX, "maxX must not be null");
        Objects.requireNonNull(maxY, "maxY must not be null");
        if (minX.compareTo(maxX) > 0 || minY.compareTo(maxY) > 0) {
            throw new IllegalArgumentException("Empty extent: " + minX + "," + minY + " .. " + maxX + "," + maxY);
        }
    }

    /**
     * Box spanned by the pin connection points of a symbol placed with {@code rotation}
     * and {@code mirror}, grown to at least {@link #MINIMUM_SIDE} per side.
     */
    public static Extent ofPins(List<Pin> pins, Position orientation) {
        Position origin = new Position(BigDecimal.ZERO, BigDecimal.ZERO, orientation.rotation(), orientation.mirror());
        BigDecimal minX = BigDecimal.ZERO;
        BigDecimal minY = BigDecimal.ZERO;
        BigDecimal maxX = BigDecimal.ZERO;
        BigDecimal maxY = BigDecimal.ZERO;
        for (Pin pin : pins) {
            Position p = origin.transform(pin.offsetX(), pin.offsetY());
            minX = minX.min(p.x());
            minY = minY.min(p.y());
            maxX = maxX.max(p.x());
            maxY = maxY.max(p.y());
        }
        return grow(minX, minY, maxX, maxY);
    }

    /**
     * Box of a sheet anchored at its top-left corner.
     */
    public static Extent ofSheet(BigDecimal width, BigDecimal height) {
        return new Extent(BigDecimal.ZERO, BigDecimal.ZERO, width, height);
    }

    private static Extent grow(BigDecimal minX, BigDecimal minY, BigDecimal maxX, BigDecimal maxY) {
        BigDecimal width = maxX.subtract(minX);
        if (width.compareTo(MINIMUM_SIDE) < 0) {
            BigDecimal pad = MINIMUM_SIDE.subtract(width).divide(TWO);
            minX = minX.subtract(pad);
            maxX = maxX.add(pad);
        }
        BigDecimal height = maxY.subtract(minY);
        if (height.compareTo(MINIMUM_SIDE) < 0) {
            BigDecimal pad = MINIMUM_SIDE.subtract(height).divide(TWO);
            minY = minY.subtract(pad);
            maxY = maxY.add(pad);
        }
        return new Extent(minX, minY, maxX, maxY);
    }
}
