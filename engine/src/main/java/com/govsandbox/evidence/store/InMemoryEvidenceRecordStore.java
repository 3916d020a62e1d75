package com.govsandbox.evidence.store;

import com.govsandbox.domain.EvidenceRecord;
import com.govsandbox.domain.EvidenceRecordStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "sandbox.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryEvidenceRecordStore implements EvidenceRecordStore {

    private final List<EvidenceRecord> records = new ArrayList<>();

    @Override
    public synchronized void append(EvidenceRecord record) {
        if (records.stream().anyMatch(r -> r.recordId().equals(record.recordId()))) {
            throw new IllegalStateException("Evidence record already stored: " + record.recordId());
        }
        records.add(record);
    }

    @Override
    public synchronized Optional<EvidenceRecord> findById(String recordId) {
        return records.stream().filter(r -> r.recordId().equals(recordId)).findFirst();
    }

    @Override
    public synchronized Optional<EvidenceRecord> latest() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }

    @Override
    public synchronized List<EvidenceRecord> findAll() {
        return List.copyOf(records);
    }
}
