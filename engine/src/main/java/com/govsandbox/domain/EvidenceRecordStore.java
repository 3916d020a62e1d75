package com.govsandbox.domain;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for signed evidence records.
 */
public interface EvidenceRecordStore {

    void append(EvidenceRecord record);

    Optional<EvidenceRecord> findById(String recordId);

    Optional<EvidenceRecord> latest();

    /** All records in creation order. */
    List<EvidenceRecord> findAll();
}
