package com.govsandbox.signature;

import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.Signature;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * ML-DSA signature authority (FIPS 204, Bouncy Castle). Generates its keypair exactly once, in the constructor;
 * the private key never leaves this object. The constructor also runs one sign/verify round trip so provider
 * lookup and class loading are paid before the first witnessed event.
 */
@Service
@Slf4j
public class MlDsaSignatureAuthority implements SignatureAuthority {

    private final String signerId;
    private final KeyPair keyPair;
    private final byte[] publicKey;
    private final String keyId;
    private final Map<String, byte[]> knownKeys;
    private final SignatureVerifier verifier;
    private final SecureRandom random = new SecureRandom();

    public MlDsaSignatureAuthority(SignatureProperties properties, MlDsaVerifier verifier) {
        BouncyCastleSupport.ensureRegistered();
        this.signerId = properties.getSignerId();
        this.verifier = verifier;
        this.keyPair = generateKeyPair(properties.getParameterSet(), random);
        this.publicKey = keyPair.getPublic().getEncoded();
        this.keyId = KeyIds.of(publicKey);

        Map<String, byte[]> keys = new LinkedHashMap<>();
        keys.put(keyId, publicKey);
        for (String encoded : properties.getTrustedPublicKeys()) {
            byte[] trusted = Base64.getDecoder().decode(encoded.strip());
            keys.putIfAbsent(KeyIds.of(trusted), trusted);
        }
        this.knownKeys = Collections.unmodifiableMap(keys);
        selfTest();
        log.info("Signature authority {} ready: {} key {} ({} trusted keys)",
                signerId, properties.getParameterSet(), keyId, knownKeys.size() - 1);
    }

    @Override
    public String signerId() {
        return signerId;
    }

    @Override
    public String keyId() {
        return keyId;
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    @Override
    public byte[] sign(byte[] digest) {
        if (digest == null || digest.length == 0) {
            throw new SandboxException(ErrorKind.INVALID_INPUT, "Cannot sign an empty digest");
        }
        try {
            Signature signer = Signature.getInstance(BouncyCastleSupport.ALGORITHM, BouncyCastleSupport.PROVIDER);
            signer.initSign(keyPair.getPrivate(), random);
            signer.update(digest);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new SandboxException(ErrorKind.SIGNATURE_FAILURE, "ML-DSA signing failed for signer " + signerId, e);
        }
    }

    @Override
    public boolean verify(byte[] digest, byte[] signature, byte[] publicKey) {
        return verifier.verify(digest, signature, publicKey);
    }

    @Override
    public Optional<byte[]> publicKeyFor(String keyId) {
        byte[] key = knownKeys.get(keyId);
        return key == null ? Optional.empty() : Optional.of(key.clone());
    }

    /** Copies; the trusted keys themselves cannot be altered through the result. */
    @Override
    public Map<String, byte[]> knownPublicKeys() {
        Map<String, byte[]> copy = new LinkedHashMap<>();
        knownKeys.forEach((id, key) -> copy.put(id, key.clone()));
        return Collections.unmodifiableMap(copy);
    }

    private void selfTest() {
        byte[] sample = new byte[32];
        random.nextBytes(sample);
        if (!verifier.verify(sample, sign(sample), publicKey)) {
            throw new SandboxException(ErrorKind.SIGNATURE_FAILURE, "ML-DSA self-test failed for signer " + signerId);
        }
    }

    private static KeyPair generateKeyPair(MlDsaParameterSet parameterSet, SecureRandom random) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(BouncyCastleSupport.ALGORITHM, BouncyCastleSupport.PROVIDER);
            generator.initialize(parameterSet.spec(), random);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new SandboxException(ErrorKind.SIGNATURE_FAILURE, "ML-DSA key generation failed for " + parameterSet, e);
        }
    }
}
