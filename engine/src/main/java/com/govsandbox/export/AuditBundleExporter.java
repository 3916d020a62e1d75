package com.govsandbox.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.govsandbox.audit.HashChainedAuditLog;
import com.govsandbox.common.CanonicalJson;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.EvidenceRecord;
import com.govsandbox.evidence.EvidenceRecordBuilder;
import com.govsandbox.signature.SignatureAuthority;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes the audit chain, evidence records, genesis constant and all known public keys to a JSON bundle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditBundleExporter {

    private final HashChainedAuditLog auditLog;
    private final EvidenceRecordBuilder evidence;
    private final SignatureAuthority signatureAuthority;
    private final Clock clock;

    public AuditBundle export() {
        long length = auditLog.size();
        List<AuditEvent> events = auditLog.range(0, length);
        String head = events.isEmpty() ? auditLog.genesisDigest() : events.get(events.size() - 1).digest();
        List<EvidenceRecord> records = evidence.allRecords().stream()
                .filter(r -> r.toIndex() <= length)
                .toList();

        Map<String, String> keys = new LinkedHashMap<>();
        signatureAuthority.knownPublicKeys()
                .forEach((keyId, key) -> keys.put(keyId, Base64.getEncoder().encodeToString(key)));

        AuditBundle unsealed = new AuditBundle(AuditBundle.FORMAT_VERSION, signatureAuthority.signerId(),
                auditLog.genesisDigest(), head, length, keys, events, records, clock.millis(), null);
        AuditBundle bundle = unsealed.withManifestDigest(unsealed.computeManifestDigest());
        log.info("Audit bundle exported: {} events, {} evidence records, head {}", length, records.size(), head);
        return bundle;
    }

    public byte[] exportBytes() {
        try {
            return CanonicalJson.mapper().writeValueAsBytes(export());
        } catch (JsonProcessingException e) {
            throw new SandboxException(ErrorKind.EXPORT_FAILURE, "Audit bundle serialization failed", e);
        }
    }

    public Path writeTo(Path target) {
        try {
            Files.write(target, exportBytes());
            return target;
        } catch (IOException e) {
            throw new SandboxException(ErrorKind.EXPORT_FAILURE, "Could not write audit bundle to " + target, e);
        }
    }
}
