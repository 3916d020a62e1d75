package com.govsandbox.export;

import com.govsandbox.common.CanonicalJson;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.EvidenceRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Self-contained export of the audit chain and evidence records: everything needed to re-verify every digest,
 * link and signature without a running sandbox. {@code publicKeys} maps key id to Base64 X.509 key.
 */
public record AuditBundle(int formatVersion, String signerId, String genesisDigest, String headDigest,
                          long chainLength, Map<String, String> publicKeys, List<AuditEvent> events,
                          List<EvidenceRecord> evidenceRecords, long exportedAtMs, String manifestDigest) {

    public static final int FORMAT_VERSION = 1;

    public AuditBundle {
        publicKeys = publicKeys == null ? Map.of() : Map.copyOf(publicKeys);
        events = events == null ? List.of() : List.copyOf(events);
        evidenceRecords = evidenceRecords == null ? List.of() : List.copyOf(evidenceRecords);
    }

    /**
     * SHA3-256 over the canonical encoding of every field except {@code manifestDigest}.
     */
    public String computeManifestDigest() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("formatVersion", formatVersion);
        content.put("signerId", signerId);
        content.put("genesisDigest", genesisDigest);
        content.put("headDigest", headDigest);
        content.put("chainLength", chainLength);
        content.put("publicKeys", publicKeys);
        content.put("events", events);
        content.put("evidenceRecords", evidenceRecords);
        content.put("exportedAtMs", exportedAtMs);
        return CanonicalJson.sha3Hex(content);
    }

    AuditBundle withManifestDigest(String digest) {
        return new AuditBundle(formatVersion, signerId, genesisDigest, headDigest, chainLength, publicKeys, events,
                evidenceRecords, exportedAtMs, digest);
    }
}
