package com.circuitsync.core.annotation;

import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.Pin;
import com.circuitsync.core.model.Position;

import java.util.Optional;

/**
 * Locates the connection point of an endpoint in one fragment.
 *
 * <p>The returned position carries the angle a label at that point should take as its
 * rotation.
 */
@FunctionalInterface
public interface AnchorResolver {

    Optional<Position> anchor(Endpoint endpoint);

    /**
     * Connection point of a component pin, with the label facing away from the body.
     */
    static Optional<Position> pinAnchor(Component component, String pinNumber) {
        Optional<Pin> pin = component.pin(pinNumber);
        Optional<Position> point = component.pinPosition(pinNumber);
        if (pin.isEmpty() || point.isEmpty()) {
            return Optional.empty();
        }
        int angle = pin.get().angle() + 180 + component.position().rotation();
        return Optional.of(new Position(point.get().x(), point.get().y(), angle, null));
    }
}
