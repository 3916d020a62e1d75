package com.govsandbox.signature;

import com.govsandbox.common.Digests;

/**
 * Key fingerprints: first 16 hex chars of SHA3-256 over the encoded public key.
 */
public final class KeyIds {

    private static final int LENGTH = 16;

    private KeyIds() {
    }

    public static String of(byte[] publicKey) {
        return Digests.sha3Hex(publicKey).substring(0, LENGTH);
    }
}
