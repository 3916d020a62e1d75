package com.govsandbox.audit.store;

import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

/**
 * Persisted form of one audit chain entry. Unique index on {@code index} (see {@link MongoAuditEventStore}).
 */
@Document(collection = "audit_events")
@NoArgsConstructor
@Getter
@Setter
public class AuditEventDocument {

    @Id
    private String eventId;
    private long index;
    private AuditEventKind kind;
    private long timestampMs;
    private String actor;
    private Map<String, String> payload;
    private ComplianceTier tier;
    private String previousDigest;
    private String digest;
    private String signature;
    private String signerKeyId;

    static AuditEventDocument from(AuditEvent event) {
        AuditEventDocument doc = new AuditEventDocument();
        doc.setEventId(event.eventId());
        doc.setIndex(event.index());
        doc.setKind(event.kind());
        doc.setTimestampMs(event.timestampMs());
        doc.setActor(event.actor());
        doc.setPayload(event.payload());
        doc.setTier(event.tier());
        doc.setPreviousDigest(event.previousDigest());
        doc.setDigest(event.digest());
        doc.setSignature(event.signature());
        doc.setSignerKeyId(event.signerKeyId());
        return doc;
    }

    AuditEvent toEvent() {
        return AuditEvent.builder()
                .index(index)
                .eventId(eventId)
                .kind(kind)
                .timestampMs(timestampMs)
                .actor(actor)
                .payload(payload)
                .tier(tier)
                .previousDigest(previousDigest)
                .digest(digest)
                .signature(signature)
                .signerKeyId(signerKeyId)
                .build();
    }
}
