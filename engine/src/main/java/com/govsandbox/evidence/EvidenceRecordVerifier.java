package com.govsandbox.evidence;

import com.govsandbox.common.Digests;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.EvidenceRecord;
import com.govsandbox.signature.SignatureVerifier;

import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Side-effect-free evidence record check, shared by the live builder and offline bundle verification.
 */
public final class EvidenceRecordVerifier {

    private final SignatureVerifier signatureVerifier;
    private final Function<String, Optional<byte[]>> publicKeyByKeyId;

    public EvidenceRecordVerifier(SignatureVerifier signatureVerifier, Function<String, Optional<byte[]>> publicKeyByKeyId) {
        this.signatureVerifier = signatureVerifier;
        this.publicKeyByKeyId = publicKeyByKeyId;
    }

    /**
     * @param events the log entries [record.fromIndex, record.toIndex), ascending
     * @return true only if the recomputed range digest matches and the signature over the record body verifies
     *         under a known key
     */
    public boolean verify(EvidenceRecord record, List<AuditEvent> events) {
        if (record.fromIndex() < 0 || record.toIndex() <= record.fromIndex() || events.size() != record.eventCount()) {
            return false;
        }
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i).index() != record.fromIndex() + i) {
                return false;
            }
        }
        String recomputed = EvidenceRecord.computeRangeDigest(record.fromIndex(), record.toIndex(), events);
        if (!recomputed.equals(record.rangeDigest()) || record.signature() == null) {
            return false;
        }
        Optional<byte[]> publicKey = publicKeyByKeyId.apply(record.signerKeyId());
        if (publicKey.isEmpty()) {
            return false;
        }
        byte[] signature;
        try {
            signature = Base64.getDecoder().decode(record.signature());
        } catch (IllegalArgumentException e) {
            return false;
        }
        return signatureVerifier.verify(Digests.fromHex(record.computeBodyDigest()), signature, publicKey.get());
    }
}
