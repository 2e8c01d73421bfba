package com.circuitsync.core.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Placement of an entity on a sheet, in millimetres with the y axis pointing down.
 *
 * <p>Coordinates are exact decimals so that a position read from a document is
 * written back with the same digits.
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 * @param rotation rotation in degrees, normalized to [0, 360)
 * @param mirror mirror state
 */
public record Position(BigDecimal x, BigDecimal y, int rotation, Mirror mirror) {

    private static final int DERIVED_SCALE = 4;

    public Position {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        rotation = Math.floorMod(rotation, 360);
        if (mirror == null) {
            mirror = Mirror.NONE;
        }
    }

    public static Position at(BigDecimal x, BigDecimal y) {
        return new Position(x, y, 0, Mirror.NONE);
    }

    public static Position at(String x, String y) {
        return at(new BigDecimal(x), new BigDecimal(y));
    }

    /**
     * Absolute sheet position of a point given in symbol coordinates (y axis up)
     * relative to this position, applying mirror then the counter-clockwise rotation.
     *
     * @param localX symbol x
     * @param localY symbol y
     * @return absolute point with rotation 0
     */
    public Position transform(BigDecimal localX, BigDecimal localY) {
        BigDecimal lx = localX;
        BigDecimal ly = localY.negate();
        if (mirror == Mirror.X) {
            ly = ly.negate();
        } else if (mirror == Mirror.Y) {
            lx = lx.negate();
        }

        BigDecimal rx;
        BigDecimal ry;
        switch (rotation) {
            case 0 -> {
                rx = lx;
                ry = ly;
            }
            case 90 -> {
                rx = ly;
                ry = lx.negate();
            }
            case 180 -> {
                rx = lx.negate();
                ry = ly.negate();
            }
            case 270 -> {
                rx = ly.negate();
                ry = lx;
            }
            default -> {
                double r = Math.toRadians(rotation);
                double dx = lx.doubleValue() * Math.cos(r) + ly.doubleValue() * Math.sin(r);
                double dy = ly.doubleValue() * Math.cos(r) - lx.doubleValue() * Math.sin(r);
                rx = new BigDecimal(dx, MathContext.DECIMAL64).setScale(DERIVED_SCALE, RoundingMode.HALF_UP);
                ry = new BigDecimal(dy, MathContext.DECIMAL64).setScale(DERIVED_SCALE, RoundingMode.HALF_UP);
            }
        }
        return at(x.add(rx), y.add(ry));
    }

    /**
     * Euclidean distance between the two points, ignoring rotation.
     */
    public double distanceTo(Position other) {
        double dx = x.subtract(other.x).doubleValue();
        double dy = y.subtract(other.y).doubleValue();
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Point equality on numeric value, so {@code 1.0} equals {@code 1}.
     */
    public boolean samePoint(Position other) {
        return x.compareTo(other.x) == 0 && y.compareTo(other.y) == 0;
    }

    /**
     * Full equality on numeric value of all fields.
     */
    public boolean samePlacement(Position other) {
        return samePoint(other) && rotation == other.rotation && mirror == other.mirror;
    }
}
