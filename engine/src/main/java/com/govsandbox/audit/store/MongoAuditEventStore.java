package com.govsandbox.audit.store;

import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Durable chain storage in {@code audit_events}. Insert-only; the unique index on {@code index} rejects a
 * second writer racing for the same position.
 */
@Repository
@ConditionalOnProperty(name = "sandbox.store.type", havingValue = "mongo")
public class MongoAuditEventStore implements AuditEventStore {

    private static final String INDEX_FIELD = "index";

    private final MongoTemplate mongoTemplate;

    public MongoAuditEventStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
        mongoTemplate.indexOps(AuditEventDocument.class)
                .ensureIndex(new Index().on(INDEX_FIELD, Sort.Direction.ASC).unique());
    }

    @Override
    public void append(AuditEvent event) {
        long size = size();
        if (event.index() != size) {
            throw new IllegalStateException("Append at index " + event.index() + " but store holds " + size);
        }
        try {
            mongoTemplate.insert(AuditEventDocument.from(event));
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("Audit index " + event.index() + " already written", e);
        }
    }

    @Override
    public long size() {
        return mongoTemplate.count(new Query(), AuditEventDocument.class);
    }

    @Override
    public Optional<AuditEvent> get(long index) {
        Query query = new Query(where(INDEX_FIELD).is(index));
        return Optional.ofNullable(mongoTemplate.findOne(query, AuditEventDocument.class))
                .map(AuditEventDocument::toEvent);
    }

    @Override
    public Optional<AuditEvent> last() {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, INDEX_FIELD)).limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, AuditEventDocument.class))
                .map(AuditEventDocument::toEvent);
    }

    @Override
    public List<AuditEvent> range(long fromInclusive, long toExclusive) {
        if (fromInclusive >= toExclusive) {
            return List.of();
        }
        Query query = new Query(where(INDEX_FIELD).gte(fromInclusive).lt(toExclusive))
                .with(Sort.by(Sort.Direction.ASC, INDEX_FIELD));
        return mongoTemplate.find(query, AuditEventDocument.class).stream()
                .map(AuditEventDocument::toEvent)
                .toList();
    }
}
