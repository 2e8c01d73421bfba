package com.circuitsync.core.model;

/**
 * Thrown when two desired entities claim one stable identity or one reference label.
 */
public class IdentityConflictException extends RuntimeException {

    private final String identity;

    public IdentityConflictException(String identity, String message) {
        super(message);
        this.identity = identity;
    }

    /**
     * @return the contested identity or reference
     */
    public String getIdentity() {
        return identity;
    }
}
