package com.govsandbox.domain;

import com.govsandbox.common.CanonicalJson;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One witnessed entry of the hash chain. Immutable; the chain is append-only.
 * {@code digest} commits to every content field and to {@code previousDigest};
 * {@code signature} (Base64 ML-DSA over the raw digest bytes) and {@code signerKeyId} are not part of the digest.
 */
@Builder(toBuilder = true)
public record AuditEvent(
        long index,
        String eventId,
        AuditEventKind kind,
        long timestampMs,
        String actor,
        Map<String, String> payload,
        ComplianceTier tier,
        String previousDigest,
        String digest,
        String signature,
        String signerKeyId) {

    public AuditEvent {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(payload));
    }

    /**
     * Recomputes the chain digest from the content fields and the stored previous link.
     */
    public String computeDigest() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("index", index);
        content.put("eventId", eventId);
        content.put("kind", kind.name());
        content.put("timestampMs", timestampMs);
        content.put("actor", actor);
        content.put("payload", payload);
        content.put("tier", tier.name());
        content.put("previousDigest", previousDigest);
        return CanonicalJson.sha3Hex(content);
    }

    public boolean hasSignature() {
        return signature != null && !signature.isEmpty();
    }

    public String payloadValue(String key) {
        return payload.get(key);
    }
}
