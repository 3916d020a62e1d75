package com.govsandbox.signature;

import java.util.Map;
import java.util.Optional;

/**
 * Holds the witness signing keypair and signs payload digests. The keypair is created once per process.
 */
public interface SignatureAuthority extends SignatureVerifier {

    String signerId();

    /** Fingerprint of {@link #publicKey()}, stored next to every signature it produces. */
    String keyId();

    /** X.509-encoded public key. */
    byte[] publicKey();

    byte[] sign(byte[] digest);

    /**
     * Public key for a key id: this authority's own key or a configured trusted key.
     */
    Optional<byte[]> publicKeyFor(String keyId);

    /** Key id to X.509-encoded public key, own key included. */
    Map<String, byte[]> knownPublicKeys();
}
