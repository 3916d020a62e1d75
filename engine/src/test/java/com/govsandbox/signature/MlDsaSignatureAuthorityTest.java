package com.govsandbox.signature;

import com.govsandbox.common.Digests;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MlDsaSignatureAuthorityTest {

    private static MlDsaVerifier verifier;
    private static MlDsaSignatureAuthority authority;

    @BeforeAll
    static void setUp() {
        verifier = new MlDsaVerifier();
        authority = new MlDsaSignatureAuthority(new SignatureProperties(), verifier);
    }

    @Test
    @DisplayName("signature over a digest verifies under the authority's public key")
    void signThenVerify() {
        byte[] digest = Digests.sha3("transfer A->B 250.00".getBytes());

        byte[] signature = authority.sign(digest);

        assertThat(authority.verify(digest, signature, authority.publicKey())).isTrue();
        assertThat(verifier.verify(digest, signature, authority.publicKey())).isTrue();
    }

    @Test
    @DisplayName("flipping any single bit of the digest fails verification")
    void digestBitFlipsFail() {
        byte[] digest = Digests.sha3("payload".getBytes());
        byte[] signature = authority.sign(digest);

        for (int bit : new int[]{0, 7, 100, 255}) {
            byte[] mutated = digest.clone();
            mutated[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThat(authority.verify(mutated, signature, authority.publicKey()))
                    .as("bit %d of digest flipped", bit)
                    .isFalse();
        }
    }

    @Test
    @DisplayName("flipping a bit of the signature fails verification")
    void signatureBitFlipsFail() {
        byte[] digest = Digests.sha3("payload".getBytes());
        byte[] signature = authority.sign(digest);

        for (int index : new int[]{0, signature.length / 2, signature.length - 1}) {
            byte[] mutated = signature.clone();
            mutated[index] ^= 0x01;
            assertThat(authority.verify(digest, mutated, authority.publicKey()))
                    .as("byte %d of signature flipped", index)
                    .isFalse();
        }
    }

    @Test
    @DisplayName("another authority's key does not verify the signature")
    void foreignKeyFails() {
        MlDsaSignatureAuthority other = new MlDsaSignatureAuthority(new SignatureProperties(), verifier);
        byte[] digest = Digests.sha3("payload".getBytes());

        assertThat(authority.verify(digest, authority.sign(digest), other.publicKey())).isFalse();
        assertThat(other.keyId()).isNotEqualTo(authority.keyId());
    }

    @Test
    @DisplayName("malformed key or empty signature verifies as false instead of throwing")
    void malformedInputsAreFalse() {
        byte[] digest = Digests.sha3("payload".getBytes());

        assertThat(verifier.verify(digest, authority.sign(digest), new byte[]{1, 2, 3})).isFalse();
        assertThat(verifier.verify(digest, new byte[0], authority.publicKey())).isFalse();
        assertThat(verifier.verify(null, authority.sign(digest), authority.publicKey())).isFalse();
    }

    @Test
    @DisplayName("empty digest cannot be signed")
    void emptyDigestRejected() {
        assertThatThrownBy(() -> authority.sign(new byte[0]))
                .isInstanceOf(SandboxException.class)
                .satisfies(e -> assertThat(((SandboxException) e).getKind()).isEqualTo(ErrorKind.INVALID_INPUT));
    }

    @Test
    @DisplayName("key material is generated once: public key and key id are stable")
    void keyIsStable() {
        assertThat(authority.publicKey()).isEqualTo(authority.publicKey());
        assertThat(authority.keyId()).isEqualTo(KeyIds.of(authority.publicKey())).hasSize(16);
        assertThat(authority.signerId()).isEqualTo("IG-WITNESS");
    }

    @Test
    @DisplayName("configured trusted keys resolve by key id alongside the own key")
    void trustedKeysResolve() {
        SignatureProperties properties = new SignatureProperties();
        properties.setTrustedPublicKeys(List.of(Base64.getEncoder().encodeToString(authority.publicKey())));
        MlDsaSignatureAuthority restarted = new MlDsaSignatureAuthority(properties, verifier);

        assertThat(restarted.publicKeyFor(authority.keyId())).contains(authority.publicKey());
        assertThat(restarted.publicKeyFor(restarted.keyId())).contains(restarted.publicKey());
        assertThat(restarted.publicKeyFor("0000000000000000")).isEmpty();
        assertThat(restarted.knownPublicKeys()).hasSize(2);
    }

    @Test
    @DisplayName("writing into a returned key does not change the trusted key")
    void knownKeysAreCopies() {
        byte[] original = authority.publicKey();
        byte[] leaked = authority.knownPublicKeys().get(authority.keyId());

        leaked[0] ^= 0x7f;

        assertThat(authority.knownPublicKeys().get(authority.keyId())).isEqualTo(original);
        assertThat(authority.publicKeyFor(authority.keyId())).contains(original);
        byte[] digest = Digests.sha3("payload".getBytes());
        assertThat(authority.verify(digest, authority.sign(digest), authority.knownPublicKeys().get(authority.keyId())))
                .isTrue();
    }

    @Test
    @DisplayName("ML-DSA-44 and ML-DSA-87 parameter sets also sign and verify")
    void otherParameterSets() {
        for (MlDsaParameterSet set : List.of(MlDsaParameterSet.ML_DSA_44, MlDsaParameterSet.ML_DSA_87)) {
            SignatureProperties properties = new SignatureProperties();
            properties.setParameterSet(set);
            MlDsaSignatureAuthority signer = new MlDsaSignatureAuthority(properties, verifier);
            byte[] digest = Digests.sha3(set.name().getBytes());
            assertThat(signer.verify(digest, signer.sign(digest), signer.publicKey())).as(set.name()).isTrue();
        }
    }
}
