package com.govsandbox.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA3-256 helpers. Digests travel as lowercase hex strings; signatures are computed over the raw 32 bytes.
 */
public final class Digests {

    public static final String ALGORITHM = "SHA3-256";
    public static final int HEX_LENGTH = 64;

    private static final HexFormat HEX = HexFormat.of();

    private Digests() {
    }

    public static byte[] sha3(byte[] data) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available in this JVM", e);
        }
    }

    public static String sha3Hex(byte[] data) {
        return HEX.formatHex(sha3(data));
    }

    public static String sha3Hex(String text) {
        return sha3Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] fromHex(String hex) {
        return HEX.parseHex(hex);
    }

    public static String toHex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    /**
     * True for a well-formed lowercase SHA3-256 hex digest.
     */
    public static boolean isDigest(String value) {
        if (value == null || value.length() != HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
