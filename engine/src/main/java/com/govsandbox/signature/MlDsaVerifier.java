package com.govsandbox.signature;

import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.NoSuchProviderException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;

/**
 * ML-DSA verification against an X.509-encoded public key. Malformed keys or signatures verify as false;
 * a missing provider is an environment failure and is thrown.
 */
@Component
@Slf4j
public class MlDsaVerifier implements SignatureVerifier {

    public MlDsaVerifier() {
        BouncyCastleSupport.ensureRegistered();
    }

    @Override
    public boolean verify(byte[] digest, byte[] signature, byte[] publicKey) {
        if (isEmpty(digest) || isEmpty(signature) || isEmpty(publicKey)) {
            return false;
        }
        try {
            PublicKey key = KeyFactory.getInstance(BouncyCastleSupport.ALGORITHM, BouncyCastleSupport.PROVIDER)
                    .generatePublic(new X509EncodedKeySpec(publicKey));
            Signature verifier = Signature.getInstance(BouncyCastleSupport.ALGORITHM, BouncyCastleSupport.PROVIDER);
            verifier.initVerify(key);
            verifier.update(digest);
            return verifier.verify(signature);
        } catch (NoSuchAlgorithmException | NoSuchProviderException e) {
            throw new SandboxException(ErrorKind.SIGNATURE_FAILURE, "ML-DSA provider unavailable", e);
        } catch (InvalidKeySpecException | InvalidKeyException | SignatureException | IllegalArgumentException e) {
            log.debug("Signature rejected as malformed: {}", e.getMessage());
            return false;
        }
    }

    private static boolean isEmpty(byte[] bytes) {
        return bytes == null || bytes.length == 0;
    }
}
