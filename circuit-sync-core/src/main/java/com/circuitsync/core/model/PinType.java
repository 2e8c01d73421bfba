package com.circuitsync.core.model;

import java.util.Locale;

/**
 * Electrical type of a pin, named after the document tokens.
 */
public enum PinType {
    INPUT,
    OUTPUT,
    BIDIRECTIONAL,
    TRI_STATE,
    PASSIVE,
    FREE,
    UNSPECIFIED,
    POWER_IN,
    POWER_OUT,
    OPEN_COLLECTOR,
    OPEN_EMITTER,
    NO_CONNECT;

    /**
     * @return the token used in documents, e.g. {@code power_in}
     */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a document token; unknown tokens map to {@link #UNSPECIFIED}.
     */
    public static PinType fromToken(String token) {
        if (token == null) {
            return UNSPECIFIED;
        }
        try {
            return valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNSPECIFIED;
        }
    }
}
