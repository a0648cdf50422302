package com.archlens.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic identifier generation.
 *
 * <p>Ids are SHA-256 digests of their inputs, so the same path always yields the
 * same node id across discovery cycles. This keeps persisted graphs diffable.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String nodeId = "node_" + IdGenerator.generate("src/core/engine.ts");
 * String edgeId = "edge_" + IdGenerator.generate(fromId, toId, "dependency");
 * }</pre>
 */
public final class IdGenerator {

    private static final int SHORT_ID_LENGTH = 16;
    private static final String SEPARATOR = "\u0000";

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a 16-character id from one or more components.
     *
     * @param components id components, joined with a separator that cannot occur in paths
     * @return 16 lowercase hex characters
     * @throws IllegalArgumentException if no component is given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return sha256(String.join(SEPARATOR, components)).substring(0, SHORT_ID_LENGTH);
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
