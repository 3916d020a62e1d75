package com.govsandbox.domain;

import com.govsandbox.common.CanonicalJson;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Signed, immutable summary of the contiguous log span [fromIndex, toIndex).
 * A corrected record is a new record with a new id; records are never re-signed.
 * The signature covers {@link #computeBodyDigest()}, i.e. every field except itself.
 */
@Builder(toBuilder = true)
public record EvidenceRecord(
        String recordId,
        long fromIndex,
        long toIndex,
        String rangeDigest,
        String signature,
        String signerId,
        String signerKeyId,
        ComplianceTier attestation,
        long createdAtMs) {

    public EvidenceRecord {
        Objects.requireNonNull(recordId, "recordId must not be null");
        Objects.requireNonNull(rangeDigest, "rangeDigest must not be null");
    }

    public long eventCount() {
        return toIndex - fromIndex;
    }

    /** Digest of every field apart from {@code signature}. */
    public String computeBodyDigest() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recordId", recordId);
        body.put("fromIndex", fromIndex);
        body.put("toIndex", toIndex);
        body.put("rangeDigest", rangeDigest);
        body.put("signerId", signerId);
        body.put("signerKeyId", signerKeyId);
        body.put("attestation", attestation == null ? null : attestation.name());
        body.put("createdAtMs", createdAtMs);
        return CanonicalJson.sha3Hex(body);
    }

    /**
     * Digest of the ordered events in range. Uses each event's recomputed content digest, so editing any
     * field of any event in the span changes the result even if the stored digest was left untouched.
     */
    public static String computeRangeDigest(long fromIndex, long toIndex, List<AuditEvent> events) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("fromIndex", fromIndex);
        content.put("toIndex", toIndex);
        content.put("eventDigests", events.stream().map(AuditEvent::computeDigest).toList());
        return CanonicalJson.sha3Hex(content);
    }
}
