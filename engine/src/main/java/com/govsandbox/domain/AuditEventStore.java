package com.govsandbox.domain;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for the audit chain. Implementations never edit, delete or reorder entries;
 * index positions are dense and start at 0.
 */
public interface AuditEventStore {

    /**
     * Appends the event at position {@code event.index()}, which must equal {@link #size()}.
     */
    void append(AuditEvent event);

    long size();

    Optional<AuditEvent> get(long index);

    Optional<AuditEvent> last();

    /**
     * Events with index in [fromInclusive, toExclusive), ascending.
     */
    List<AuditEvent> range(long fromInclusive, long toExclusive);
}
