package com.govsandbox.audit;

import com.govsandbox.audit.ChainIntegrityViolationException.BreakType;
import com.govsandbox.common.Digests;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.signature.SignatureVerifier;

import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Pure re-verification of a chain segment. Used by the live log and by offline bundle verification,
 * so it depends only on the events, the expected predecessor link and a public-key lookup.
 */
public final class AuditChainVerifier {

    private final SignatureVerifier signatureVerifier;
    private final Function<String, Optional<byte[]>> publicKeyByKeyId;

    public AuditChainVerifier(SignatureVerifier signatureVerifier, Function<String, Optional<byte[]>> publicKeyByKeyId) {
        this.signatureVerifier = signatureVerifier;
        this.publicKeyByKeyId = publicKeyByKeyId;
    }

    /**
     * Checks, per event in order: dense index, previous link, recomputed digest, signature.
     *
     * @param startIndex     index the first event must carry
     * @param previousDigest digest of the entry before {@code startIndex} (the genesis constant when 0)
     * @return digest of the last event, or {@code previousDigest} for an empty segment
     * @throws ChainIntegrityViolationException at the first broken link
     */
    public String verify(List<AuditEvent> events, long startIndex, String previousDigest) {
        String expectedPrevious = previousDigest;
        long expectedIndex = startIndex;
        for (AuditEvent event : events) {
            if (event.index() != expectedIndex) {
                throw new ChainIntegrityViolationException(expectedIndex, event.eventId(), BreakType.SEQUENCE_GAP,
                        "expected index " + expectedIndex + " but found " + event.index());
            }
            if (!expectedPrevious.equals(event.previousDigest())) {
                throw new ChainIntegrityViolationException(expectedIndex, event.eventId(), BreakType.LINK_MISMATCH,
                        "previous digest does not match predecessor");
            }
            String recomputed = event.computeDigest();
            if (!recomputed.equals(event.digest())) {
                throw new ChainIntegrityViolationException(expectedIndex, event.eventId(), BreakType.DIGEST_MISMATCH,
                        "stored digest differs from recomputed content digest");
            }
            verifySignature(event);
            expectedPrevious = event.digest();
            expectedIndex++;
        }
        return expectedPrevious;
    }

    private void verifySignature(AuditEvent event) {
        if (!event.hasSignature()) {
            throw new ChainIntegrityViolationException(event.index(), event.eventId(), BreakType.SIGNATURE_INVALID,
                    "event is not signed");
        }
        byte[] publicKey = publicKeyByKeyId.apply(event.signerKeyId())
                .orElseThrow(() -> new ChainIntegrityViolationException(event.index(), event.eventId(),
                        BreakType.UNKNOWN_SIGNER_KEY, "no public key for key id " + event.signerKeyId()));
        byte[] signature;
        try {
            signature = Base64.getDecoder().decode(event.signature());
        } catch (IllegalArgumentException e) {
            throw new ChainIntegrityViolationException(event.index(), event.eventId(), BreakType.SIGNATURE_INVALID,
                    "signature is not valid Base64");
        }
        if (!signatureVerifier.verify(Digests.fromHex(event.digest()), signature, publicKey)) {
            throw new ChainIntegrityViolationException(event.index(), event.eventId(), BreakType.SIGNATURE_INVALID,
                    "signature does not verify under key " + event.signerKeyId());
        }
    }
}
