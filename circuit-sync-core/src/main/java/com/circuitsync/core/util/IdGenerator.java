package com.circuitsync.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Deterministic identifiers derived from SHA-256.
 *
 * <p>Fragment file names and generated element uuids are computed from stable
 * identities so that repeated runs address the same file and element.
 */
public final class IdGenerator {

    private static final int SHORT_ID_LENGTH = 16;

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a 16 character id from one or more components joined with {@code ':'}.
     *
     * @param components id components
     * @return deterministic hex id
     * @throws IllegalArgumentException when no component is given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return sha256Hex(String.join(":", components)).substring(0, SHORT_ID_LENGTH);
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Name-based uuid (version 3) for the given components, in the textual form the
     * schematic format stores.
     */
    public static String uuid(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return UUID.nameUUIDFromBytes(String.join(":", components).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
