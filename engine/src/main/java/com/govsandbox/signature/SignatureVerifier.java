package com.govsandbox.signature;

/**
 * Pure signature predicate: no state, no side effects, never throws for malformed input.
 */
public interface SignatureVerifier {

    boolean verify(byte[] digest, byte[] signature, byte[] publicKey);
}
