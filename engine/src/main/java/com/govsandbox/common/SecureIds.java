package com.govsandbox.common;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Identifier generation backed by {@link SecureRandom}: 128 random bits per id, so collisions under
 * concurrent issuance are negligible. SecureRandom is thread-safe; one instance is shared.
 */
public final class SecureIds {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int RANDOM_BYTES = 16;

    private SecureIds() {
    }

    /**
     * Returns e.g. {@code TX-3f0c...} (prefix, dash, 32 lowercase hex chars).
     */
    public static String next(String prefix) {
        byte[] bytes = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(bytes);
        return prefix + "-" + HexFormat.of().formatHex(bytes);
    }
}
