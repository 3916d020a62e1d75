package com.govsandbox.export;

import com.govsandbox.audit.AuditChainVerifier;
import com.govsandbox.audit.ChainIntegrityViolationException;
import com.govsandbox.common.CanonicalJson;
import com.govsandbox.common.Digests;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.EvidenceRecord;
import com.govsandbox.evidence.EvidenceRecordVerifier;
import com.govsandbox.signature.KeyIds;
import com.govsandbox.signature.MlDsaVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-verifies an exported {@link AuditBundle} with no access to the live sandbox: manifest, chain links, digests,
 * event signatures and evidence records. Keys come from the bundle unless pinned keys are supplied.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OfflineAuditVerifier {

    private final MlDsaVerifier signatureVerifier;

    /**
     * @throws SandboxException EXPORT_FAILURE if the bytes are not a readable bundle
     */
    public BundleVerificationReport verify(byte[] bundleJson) {
        return verify(parse(bundleJson), Map.of());
    }

    public AuditBundle parse(byte[] bundleJson) {
        try {
            return CanonicalJson.mapper().readValue(bundleJson, AuditBundle.class);
        } catch (IOException e) {
            throw new SandboxException(ErrorKind.EXPORT_FAILURE, "Unreadable audit bundle", e);
        }
    }

    /**
     * @param pinnedKeys key id to X.509 public key; when non-empty, keys embedded in the bundle are ignored
     */
    public BundleVerificationReport verify(AuditBundle bundle, Map<String, byte[]> pinnedKeys) {
        List<String> problems = new ArrayList<>();
        if (bundle.formatVersion() != AuditBundle.FORMAT_VERSION) {
            problems.add("unsupported format version " + bundle.formatVersion());
        }
        if (bundle.manifestDigest() == null || !bundle.manifestDigest().equals(bundle.computeManifestDigest())) {
            problems.add("manifest digest mismatch");
        }
        if (!Digests.isDigest(bundle.genesisDigest())) {
            problems.add("genesis digest is not a SHA3-256 hex digest");
        }
        if (bundle.chainLength() != bundle.events().size()) {
            problems.add("chain length " + bundle.chainLength() + " but " + bundle.events().size() + " events");
        }

        Map<String, byte[]> keys = pinnedKeys.isEmpty() ? decodeKeys(bundle.publicKeys(), problems) : pinnedKeys;
        AuditChainVerifier chainVerifier = new AuditChainVerifier(signatureVerifier, id -> Optional.ofNullable(keys.get(id)));
        long firstBroken = -1;
        long eventsVerified = 0;
        try {
            String head = chainVerifier.verify(bundle.events(), 0, bundle.genesisDigest());
            eventsVerified = bundle.events().size();
            if (!head.equals(bundle.headDigest())) {
                problems.add("head digest does not match last event");
            }
        } catch (ChainIntegrityViolationException e) {
            firstBroken = e.getBrokenIndex();
            eventsVerified = e.getBrokenIndex();
            problems.add(e.getMessage());
        }

        EvidenceRecordVerifier recordVerifier = new EvidenceRecordVerifier(signatureVerifier, id -> Optional.ofNullable(keys.get(id)));
        int recordsVerified = 0;
        for (EvidenceRecord record : bundle.evidenceRecords()) {
            if (recordVerifier.verify(record, eventsIn(bundle.events(), record))) {
                recordsVerified++;
            } else {
                problems.add("evidence record " + record.recordId() + " does not verify");
            }
        }

        boolean valid = problems.isEmpty();
        if (valid) {
            log.info("Audit bundle verified: {} events, {} evidence records", eventsVerified, recordsVerified);
        } else {
            log.error("Audit bundle verification FAILED: {}", problems);
        }
        return new BundleVerificationReport(valid, eventsVerified, recordsVerified, firstBroken, problems);
    }

    private static List<AuditEvent> eventsIn(List<AuditEvent> events, EvidenceRecord record) {
        if (record.fromIndex() < 0 || record.toIndex() > events.size() || record.fromIndex() >= record.toIndex()) {
            return List.of();
        }
        return events.subList((int) record.fromIndex(), (int) record.toIndex());
    }

    private static Map<String, byte[]> decodeKeys(Map<String, String> encoded, List<String> problems) {
        Map<String, byte[]> keys = new HashMap<>();
        encoded.forEach((keyId, key) -> {
            try {
                byte[] decoded = Base64.getDecoder().decode(key);
                if (KeyIds.of(decoded).equals(keyId)) {
                    keys.put(keyId, decoded);
                } else {
                    problems.add("public key " + keyId + " does not match its key id");
                }
            } catch (IllegalArgumentException e) {
                problems.add("public key " + keyId + " is not valid Base64");
            }
        });
        return keys;
    }
}
