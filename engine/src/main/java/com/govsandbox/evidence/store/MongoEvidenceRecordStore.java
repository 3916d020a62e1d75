package com.govsandbox.evidence.store;

import com.govsandbox.domain.EvidenceRecord;
import com.govsandbox.domain.EvidenceRecordStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Insert-only evidence storage in {@code evidence_records}.
 */
@Repository
@ConditionalOnProperty(name = "sandbox.store.type", havingValue = "mongo")
public class MongoEvidenceRecordStore implements EvidenceRecordStore {

    private static final String SEQUENCE_FIELD = "sequence";

    private final MongoTemplate mongoTemplate;

    public MongoEvidenceRecordStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
        mongoTemplate.indexOps(EvidenceRecordDocument.class)
                .ensureIndex(new Index().on(SEQUENCE_FIELD, Sort.Direction.ASC).unique());
    }

    @Override
    public synchronized void append(EvidenceRecord record) {
        long sequence = mongoTemplate.count(new Query(), EvidenceRecordDocument.class);
        try {
            mongoTemplate.insert(EvidenceRecordDocument.from(record, sequence));
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("Evidence record " + record.recordId() + " conflicts with a stored record", e);
        }
    }

    @Override
    public Optional<EvidenceRecord> findById(String recordId) {
        return Optional.ofNullable(mongoTemplate.findById(recordId, EvidenceRecordDocument.class))
                .map(EvidenceRecordDocument::toRecord);
    }

    @Override
    public Optional<EvidenceRecord> latest() {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, SEQUENCE_FIELD)).limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, EvidenceRecordDocument.class))
                .map(EvidenceRecordDocument::toRecord);
    }

    @Override
    public List<EvidenceRecord> findAll() {
        Query query = new Query().with(Sort.by(Sort.Direction.ASC, SEQUENCE_FIELD));
        return mongoTemplate.find(query, EvidenceRecordDocument.class).stream()
                .map(EvidenceRecordDocument::toRecord)
                .toList();
    }
}
