package com.govsandbox.audit.store;

import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Process-local chain storage. Default when {@code sandbox.store.type} is unset.
 */
@Component
@ConditionalOnProperty(name = "sandbox.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryAuditEventStore implements AuditEventStore {

    private final List<AuditEvent> events = new ArrayList<>();

    @Override
    public synchronized void append(AuditEvent event) {
        if (event.index() != events.size()) {
            throw new IllegalStateException("Append at index " + event.index() + " but store holds " + events.size());
        }
        events.add(event);
    }

    @Override
    public synchronized long size() {
        return events.size();
    }

    @Override
    public synchronized Optional<AuditEvent> get(long index) {
        if (index < 0 || index >= events.size()) {
            return Optional.empty();
        }
        return Optional.of(events.get((int) index));
    }

    @Override
    public synchronized Optional<AuditEvent> last() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    @Override
    public synchronized List<AuditEvent> range(long fromInclusive, long toExclusive) {
        int from = (int) Math.max(0, fromInclusive);
        int to = (int) Math.min(events.size(), toExclusive);
        if (from >= to) {
            return List.of();
        }
        return List.copyOf(events.subList(from, to));
    }
}
