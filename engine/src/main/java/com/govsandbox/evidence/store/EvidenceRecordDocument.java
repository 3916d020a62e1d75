package com.govsandbox.evidence.store;

import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.EvidenceRecord;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Persisted evidence record; {@code sequence} keeps creation order independent of clock resolution.
 */
@Document(collection = "evidence_records")
@NoArgsConstructor
@Getter
@Setter
public class EvidenceRecordDocument {

    @Id
    private String recordId;
    private long sequence;
    private long fromIndex;
    private long toIndex;
    private String rangeDigest;
    private String signature;
    private String signerId;
    private String signerKeyId;
    private ComplianceTier attestation;
    private long createdAtMs;

    static EvidenceRecordDocument from(EvidenceRecord record, long sequence) {
        EvidenceRecordDocument doc = new EvidenceRecordDocument();
        doc.setRecordId(record.recordId());
        doc.setSequence(sequence);
        doc.setFromIndex(record.fromIndex());
        doc.setToIndex(record.toIndex());
        doc.setRangeDigest(record.rangeDigest());
        doc.setSignature(record.signature());
        doc.setSignerId(record.signerId());
        doc.setSignerKeyId(record.signerKeyId());
        doc.setAttestation(record.attestation());
        doc.setCreatedAtMs(record.createdAtMs());
        return doc;
    }

    EvidenceRecord toRecord() {
        return EvidenceRecord.builder()
                .recordId(recordId)
                .fromIndex(fromIndex)
                .toIndex(toIndex)
                .rangeDigest(rangeDigest)
                .signature(signature)
                .signerId(signerId)
                .signerKeyId(signerKeyId)
                .attestation(attestation)
                .createdAtMs(createdAtMs)
                .build();
    }
}
