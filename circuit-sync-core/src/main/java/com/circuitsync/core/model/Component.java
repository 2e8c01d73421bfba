package com.circuitsync.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A placed symbol instance.
 *
 * @param key arena key, unique within its circuit
 * @param identity stable identity persisted in the document, null when not yet assigned
 * @param reference human visible label such as {@code R1}
 * @param typeId library symbol id such as {@code Device:R}
 * @param properties remaining properties (value, footprint, part number, ...)
 * @param position placement, null for desired components that were never placed
 * @param pins pins ordered as the symbol declares them
 */
public record Component(
    String key,
    String identity,
    String reference,
    String typeId,
    Map<String, String> properties,
    Position position,
    List<Pin> pins
) {
    public Component {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(typeId, "typeId must not be null");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        pins = pins == null ? List.of() : List.copyOf(pins);
    }

    public Optional<Pin> pin(String number) {
        return pins.stream().filter(p -> p.number().equals(number)).findFirst();
    }

    /**
     * Pin numbers with their electrical types, sorted, e.g. {@code 1:passive,2:passive}.
     */
    public String pinSignature() {
        return pins.stream()
            .sorted(Comparator.comparing(Pin::number))
            .map(p -> p.number() + ":" + p.type().token())
            .collect(Collectors.joining(","));
    }

    /**
     * Absolute sheet position of a pin's connection point.
     *
     * @return empty when the pin is unknown or the component is not placed
     */
    public Optional<Position> pinPosition(String number) {
        if (position == null) {
            return Optional.empty();
        }
        return pin(number).map(p -> position.transform(p.offsetX(), p.offsetY()));
    }

    public Component withPosition(Position newPosition) {
        return new Component(key, identity, reference, typeId, properties, newPosition, pins);
    }

    public Component withReference(String newReference) {
        return new Component(key, identity, newReference, typeId, properties, position, pins);
    }

    public Component withIdentity(String newIdentity) {
        return new Component(key, newIdentity, reference, typeId, properties, position, pins);
    }
}
