package com.example.quorum.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable SHA-256 identities for content. Used as the embedding content hash and
 * as the observation dedup key.
 */
public final class Fingerprints {

    private static final String SEPARATOR = ":";

    private Fingerprints() {
    }

    /** Hex SHA-256 over the parts joined with ':'. Null parts hash as empty strings. */
    public static String fingerprint(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) joined.append(SEPARATOR);
            if (parts[i] != null) joined.append(parts[i]);
        }
        return sha256(joined.toString());
    }

    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
