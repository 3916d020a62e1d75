package com.govsandbox.signature;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.Security;

/**
 * Registers the Bouncy Castle provider once per JVM. ML-DSA (FIPS 204) is not available in the JDK 17 providers.
 */
final class BouncyCastleSupport {

    static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;
    static final String ALGORITHM = "ML-DSA";

    private BouncyCastleSupport() {
    }

    static synchronized void ensureRegistered() {
        if (Security.getProvider(PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }
}
