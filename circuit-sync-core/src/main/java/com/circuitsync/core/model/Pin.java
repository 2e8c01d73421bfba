package com.circuitsync.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Pin of a component. Identified only through (component identity, number).
 *
 * @param number pin number as written in the symbol
 * @param name pin name, may be empty
 * @param type electrical type
 * @param offsetX connection point x in symbol coordinates
 * @param offsetY connection point y in symbol coordinates (y axis up)
 * @param angle pin direction in degrees
 */
public record Pin(
    String number,
    String name,
    PinType type,
    BigDecimal offsetX,
    BigDecimal offsetY,
    int angle
) {
    public Pin {
        Objects.requireNonNull(number, "number must not be null");
        if (name == null) {
            name = "";
        }
        if (type == null) {
            type = PinType.UNSPECIFIED;
        }
        if (offsetX == null) {
            offsetX = BigDecimal.ZERO;
        }
        if (offsetY == null) {
            offsetY = BigDecimal.ZERO;
        }
    }

    /**
     * Pin with no geometry, used for placeholder signatures.
     */
    public static Pin placeholder(String number) {
        return new Pin(number, "", PinType.PASSIVE, BigDecimal.ZERO, BigDecimal.ZERO, 0);
    }
}
