package com.circuitsync.core.model;

/**
 * What an {@link Endpoint} attaches to.
 */
public enum EndpointKind {
    /** A component pin; owner is the component key, terminal the pin number. */
    PIN,
    /** A boundary port of a sub-circuit instance; owner is the instance key, terminal the port name. */
    PORT
}
