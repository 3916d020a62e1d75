package com.govsandbox.evidence;

import com.govsandbox.audit.HashChainedAuditLog;
import com.govsandbox.common.Digests;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.common.SecureIds;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.EvidenceRecord;
import com.govsandbox.domain.EvidenceRecordStore;
import com.govsandbox.domain.PayloadKeys;
import com.govsandbox.signature.SignatureAuthority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Seals contiguous spans of the audit log into signed evidence records (BERs). A record is written once and
 * never re-signed; sealing the same span again yields a new record with a new id.
 */
@Service
@Slf4j
public class EvidenceRecordBuilder {

    static final String BUILDER_ACTOR = "EVIDENCE-BUILDER";

    private final HashChainedAuditLog auditLog;
    private final SignatureAuthority signatureAuthority;
    private final EvidenceRecordStore recordStore;
    private final EvidenceProperties properties;
    private final Clock clock;
    private final EvidenceRecordVerifier verifier;

    public EvidenceRecordBuilder(HashChainedAuditLog auditLog, SignatureAuthority signatureAuthority,
                                 EvidenceRecordStore recordStore, EvidenceProperties properties, Clock clock) {
        this.auditLog = auditLog;
        this.signatureAuthority = signatureAuthority;
        this.recordStore = recordStore;
        this.properties = properties;
        this.clock = clock;
        this.verifier = new EvidenceRecordVerifier(signatureAuthority, signatureAuthority::publicKeyFor);
    }

    /**
     * Verifies the chain over [fromIndex, toIndex), digests and signs it, witnesses EVIDENCE_RECORD_GENERATED,
     * then stores the record.
     *
     * @throws SandboxException INVALID_INPUT for an empty or out-of-bounds range
     * @throws com.govsandbox.audit.ChainIntegrityViolationException if the span does not verify
     */
    public synchronized EvidenceRecord buildRecord(long fromIndex, long toIndex) {
        long size = auditLog.size();
        if (fromIndex < 0 || toIndex <= fromIndex || toIndex > size) {
            throw new SandboxException(ErrorKind.INVALID_INPUT,
                    "Evidence range [" + fromIndex + ", " + toIndex + ") invalid for log length " + size);
        }
        auditLog.verifyChain(fromIndex, toIndex);
        List<AuditEvent> events = auditLog.range(fromIndex, toIndex);
        String rangeDigest = EvidenceRecord.computeRangeDigest(fromIndex, toIndex, events);
        EvidenceRecord unsigned = EvidenceRecord.builder()
                .recordId(SecureIds.next("BER"))
                .fromIndex(fromIndex)
                .toIndex(toIndex)
                .rangeDigest(rangeDigest)
                .signerId(signatureAuthority.signerId())
                .signerKeyId(signatureAuthority.keyId())
                .attestation(properties.getAttestation())
                .createdAtMs(clock.millis())
                .build();
        byte[] signature = signatureAuthority.sign(Digests.fromHex(unsigned.computeBodyDigest()));
        EvidenceRecord record = unsigned.toBuilder()
                .signature(Base64.getEncoder().encodeToString(signature))
                .build();

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.RECORD_ID, record.recordId());
        payload.put(PayloadKeys.FROM_INDEX, Long.toString(fromIndex));
        payload.put(PayloadKeys.TO_INDEX, Long.toString(toIndex));
        payload.put(PayloadKeys.RANGE_DIGEST, rangeDigest);
        auditLog.witness(AuditEventKind.EVIDENCE_RECORD_GENERATED, BUILDER_ACTOR, payload, ComplianceTier.LAW_TIER);
        recordStore.append(record);
        log.info("Evidence record {} sealed over [{}, {}) ({} events, digest {})",
                record.recordId(), fromIndex, toIndex, record.eventCount(), rangeDigest);
        return record;
    }

    /**
     * Seals everything appended since the latest record. Skips when nothing is pending apart from
     * the previous record's own EVIDENCE_RECORD_GENERATED entries.
     */
    public synchronized Optional<EvidenceRecord> sealPendingSpan() {
        long from = recordStore.latest().map(EvidenceRecord::toIndex).orElse(0L);
        long to = auditLog.size();
        if (from >= to) {
            return Optional.empty();
        }
        boolean onlyEvidenceEvents = auditLog.range(from, to).stream()
                .allMatch(e -> e.kind() == AuditEventKind.EVIDENCE_RECORD_GENERATED);
        if (onlyEvidenceEvents) {
            log.debug("No new audit events to seal after index {}", from);
            return Optional.empty();
        }
        return Optional.of(buildRecord(from, to));
    }

    /**
     * Recomputes the range digest from the current log and checks the signature. Pure predicate.
     */
    public boolean verifyRecord(EvidenceRecord record) {
        if (record.toIndex() > auditLog.size()) {
            return false;
        }
        return verifier.verify(record, auditLog.range(record.fromIndex(), record.toIndex()));
    }

    public Optional<EvidenceRecord> latestRecord() {
        return recordStore.latest();
    }

    public Optional<EvidenceRecord> findRecord(String recordId) {
        return recordStore.findById(recordId);
    }

    public List<EvidenceRecord> allRecords() {
        return recordStore.findAll();
    }
}
