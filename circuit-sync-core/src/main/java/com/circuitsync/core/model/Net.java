package com.circuitsync.core.model;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A set of endpoints sharing one name.
 *
 * <p>An explicit name is chosen by the user and stable. An implicit name is derived
 * from the endpoint set and changes whenever that set changes.
 *
 * @param name net name
 * @param explicitName true when the name was chosen by the user
 * @param netClass signal or power
 * @param endpoints endpoints, sorted and free of duplicates
 */
public record Net(String name, boolean explicitName, NetClass netClass, List<Endpoint> endpoints) {

    /** Prefix of derived net names. */
    public static final String IMPLICIT_PREFIX = "Net-(";

    public Net {
        Objects.requireNonNull(name, "name must not be null");
        if (netClass == null) {
            netClass = NetClass.SIGNAL;
        }
        endpoints = endpoints == null ? List.of() : List.copyOf(new TreeSet<>(endpoints));
    }

    /**
     * Derived name for an implicit net anchored at the given pin, e.g. {@code Net-(R1-Pad2)}.
     */
    public static String implicitName(String reference, String terminal) {
        return IMPLICIT_PREFIX + reference + "-Pad" + terminal + ")";
    }

    public static boolean isImplicitName(String name) {
        return name.startsWith(IMPLICIT_PREFIX) && name.endsWith(")");
    }

    public boolean isPower() {
        return netClass == NetClass.POWER;
    }

    public Net withName(String newName, boolean explicit) {
        return new Net(newName, explicit, netClass, endpoints);
    }

    public Net withEndpoints(List<Endpoint> newEndpoints) {
        return new Net(name, explicitName, netClass, newEndpoints);
    }
}
