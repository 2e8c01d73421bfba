package com.circuitsync.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One connection point of a net. Refers to its owner by arena key, never by object.
 *
 * @param kind pin or port
 * @param ownerKey key of the owning component or instance
 * @param terminal pin number or port name
 */
public record Endpoint(EndpointKind kind, String ownerKey, String terminal) implements Comparable<Endpoint> {

    private static final Comparator<Endpoint> ORDER = Comparator
        .comparing(Endpoint::kind)
        .thenComparing(Endpoint::ownerKey)
        .thenComparing(Endpoint::terminal);

    public Endpoint {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(ownerKey, "ownerKey must not be null");
        Objects.requireNonNull(terminal, "terminal must not be null");
    }

    public static Endpoint pin(String componentKey, String pinNumber) {
        return new Endpoint(EndpointKind.PIN, componentKey, pinNumber);
    }

    public static Endpoint port(String instanceKey, String portName) {
        return new Endpoint(EndpointKind.PORT, instanceKey, portName);
    }

    @Override
    public int compareTo(Endpoint other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return ownerKey + "." + terminal;
    }
}
