package com.govsandbox.audit;

import com.govsandbox.common.Digests;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.AuditEventStore;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.PayloadKeys;
import com.govsandbox.signature.SignatureAuthority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained, signed audit log. Each entry commits to its predecessor's digest, starting from
 * the configured genesis constant. Appends are serialized by a single fair lock; waiting for it and sealing an
 * entry are bounded by the hard latency cap.
 */
@Service
@Slf4j
public class HashChainedAuditLog {

    private static final String WARM_UP_ACTOR = "WARM-UP";

    private final AuditEventStore store;
    private final SignatureAuthority signatureAuthority;
    private final AuditProperties properties;
    private final Clock clock;
    private final AuditChainVerifier verifier;
    private final ReentrantLock appendLock = new ReentrantLock(true);

    private volatile String headDigest;
    private volatile long nextIndex;
    /** Guarded by appendLock. */
    private long lastTimestampMs;

    public HashChainedAuditLog(AuditEventStore store, SignatureAuthority signatureAuthority,
                               AuditProperties properties, Clock clock) {
        this.store = store;
        this.signatureAuthority = signatureAuthority;
        this.properties = properties;
        this.clock = clock;
        this.verifier = new AuditChainVerifier(signatureAuthority, signatureAuthority::publicKeyFor);

        Optional<AuditEvent> last = store.last();
        if (last.isPresent()) {
            this.headDigest = last.get().digest();
            this.nextIndex = last.get().index() + 1;
            this.lastTimestampMs = last.get().timestampMs();
            log.info("Audit chain resumed at index {} head {}", nextIndex, headDigest);
        } else {
            this.headDigest = properties.getGenesisDigest();
            this.nextIndex = 0;
            this.lastTimestampMs = 0;
            log.info("Audit chain starting from genesis {}", headDigest);
        }
        warmUp();
    }

    /**
     * Seals, signs and appends one event, then advances the head. Returns only after the entry is stored.
     *
     * @throws SandboxException LATENCY_CAP_EXCEEDED when the hard cap is exceeded; a COMPLIANCE_VIOLATION
     *                          entry is appended first whenever the lock can still be obtained
     */
    public AuditEvent witness(AuditEventKind kind, String actor, Map<String, String> payload, ComplianceTier tier) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        if (actor == null || actor.isBlank()) {
            throw new SandboxException(ErrorKind.INVALID_INPUT, "Audit actor must not be blank");
        }
        long startNanos = System.nanoTime();
        long hardCapNanos = properties.getHardLatency().toNanos();

        if (!tryAcquire(hardCapNanos)) {
            throw latencyFailureWithoutLock(kind, actor, startNanos, hardCapNanos);
        }
        try {
            AuditEvent event = seal(kind, actor, payload, tier);
            long elapsedNanos = System.nanoTime() - startNanos;
            if (elapsedNanos > hardCapNanos) {
                recordLatencyViolation(kind, actor, elapsedNanos);
                throw new SandboxException(ErrorKind.LATENCY_CAP_EXCEEDED,
                        "Witness of " + kind + " took " + toMillis(elapsedNanos) + "ms, hard cap "
                                + properties.getHardLatency().toMillis() + "ms");
            }
            commit(event);
            if (elapsedNanos > properties.getSoftLatency().toNanos()) {
                log.warn("Witness latency above target: {}ms > {}ms for {} {}", toMillis(elapsedNanos),
                        properties.getSoftLatency().toMillis(), kind, event.eventId());
            } else {
                log.debug("Witnessed {} {} by {} at index {}", kind, event.eventId(), actor, event.index());
            }
            return event;
        } finally {
            appendLock.unlock();
        }
    }

    public boolean verifyChain() {
        return verifyChain(0, size());
    }

    /**
     * Recomputes every digest, link and signature in [fromIndex, toIndex). A range not starting at 0 is anchored
     * on the stored digest of entry {@code fromIndex - 1}.
     *
     * @throws ChainIntegrityViolationException identifying the first broken link
     */
    public boolean verifyChain(long fromIndex, long toIndex) {
        long size = size();
        if (fromIndex < 0 || toIndex < fromIndex || toIndex > size) {
            throw new SandboxException(ErrorKind.INVALID_INPUT,
                    "Invalid chain range [" + fromIndex + ", " + toIndex + ") for length " + size);
        }
        String previous = fromIndex == 0
                ? properties.getGenesisDigest()
                : store.get(fromIndex - 1).map(AuditEvent::digest)
                        .orElseThrow(() -> new ChainIntegrityViolationException(fromIndex - 1, null,
                                ChainIntegrityViolationException.BreakType.SEQUENCE_GAP, "missing anchor entry"));
        List<AuditEvent> events = store.range(fromIndex, toIndex);
        try {
            if (events.size() != toIndex - fromIndex) {
                throw new ChainIntegrityViolationException(fromIndex + events.size(), null,
                        ChainIntegrityViolationException.BreakType.SEQUENCE_GAP,
                        "store returned " + events.size() + " entries for a span of " + (toIndex - fromIndex));
            }
            verifier.verify(events, fromIndex, previous);
        } catch (ChainIntegrityViolationException e) {
            log.error("HASH CHAIN INTEGRITY FAILURE: {}", e.getMessage());
            throw e;
        }
        log.debug("Chain verified over [{}, {})", fromIndex, toIndex);
        return true;
    }

    public String headDigest() {
        return headDigest;
    }

    public String genesisDigest() {
        return properties.getGenesisDigest();
    }

    /** Number of appended entries; the next entry gets this index. */
    public long size() {
        return nextIndex;
    }

    public Optional<AuditEvent> get(long index) {
        return store.get(index);
    }

    public List<AuditEvent> range(long fromInclusive, long toExclusive) {
        return store.range(fromInclusive, toExclusive);
    }

    /** Up to {@code count} most recent entries, oldest first. */
    public List<AuditEvent> latest(int count) {
        long size = size();
        return store.range(Math.max(0, size - Math.max(0, count)), size);
    }

    private AuditEvent seal(AuditEventKind kind, String actor, Map<String, String> payload, ComplianceTier tier) {
        long index = nextIndex;
        long timestampMs = Math.max(clock.millis(), lastTimestampMs);
        AuditEvent unsigned = AuditEvent.builder()
                .index(index)
                .eventId(String.format("AE-%010d", index))
                .kind(kind)
                .timestampMs(timestampMs)
                .actor(actor)
                .payload(payload)
                .tier(tier)
                .previousDigest(headDigest)
                .build();
        String digest = unsigned.computeDigest();
        byte[] signature = signatureAuthority.sign(Digests.fromHex(digest));
        return unsigned.toBuilder()
                .digest(digest)
                .signature(Base64.getEncoder().encodeToString(signature))
                .signerKeyId(signatureAuthority.keyId())
                .build();
    }

    /** Seals one throwaway entry so the first real witness does not pay for JSON and digest setup. */
    private void warmUp() {
        long startNanos = System.nanoTime();
        seal(AuditEventKind.COMPLIANCE_VIOLATION, WARM_UP_ACTOR, Map.of(PayloadKeys.DETAIL, "warm-up"),
                ComplianceTier.INFORMATIONAL_TIER);
        log.debug("Audit sealing warmed up in {}ms", toMillis(System.nanoTime() - startNanos));
    }

    private void commit(AuditEvent event) {
        store.append(event);
        headDigest = event.digest();
        lastTimestampMs = event.timestampMs();
        nextIndex = event.index() + 1;
    }

    private void recordLatencyViolation(AuditEventKind attemptedKind, String actor, long elapsedNanos) {
        AuditEvent violation = seal(AuditEventKind.COMPLIANCE_VIOLATION, actor, Map.of(
                PayloadKeys.VIOLATION, ErrorKind.LATENCY_CAP_EXCEEDED.name(),
                PayloadKeys.ATTEMPTED_KIND, attemptedKind.name(),
                PayloadKeys.LATENCY_MS, Long.toString(toMillis(elapsedNanos))), ComplianceTier.LAW_TIER);
        commit(violation);
        log.error("WITNESS LATENCY VIOLATION: {}ms > {}ms for {} by {}; recorded as {}", toMillis(elapsedNanos),
                properties.getHardLatency().toMillis(), attemptedKind, actor, violation.eventId());
    }

    private SandboxException latencyFailureWithoutLock(AuditEventKind kind, String actor, long startNanos,
                                                       long hardCapNanos) {
        long elapsedNanos = System.nanoTime() - startNanos;
        if (tryAcquire(hardCapNanos)) {
            try {
                recordLatencyViolation(kind, actor, elapsedNanos);
            } finally {
                appendLock.unlock();
            }
        } else {
            log.error("WITNESS LATENCY VIOLATION for {} by {} could not be recorded: append lock unavailable", kind, actor);
        }
        return new SandboxException(ErrorKind.LATENCY_CAP_EXCEEDED,
                "Append lock not acquired within " + properties.getHardLatency().toMillis() + "ms for " + kind);
    }

    private boolean tryAcquire(long timeoutNanos) {
        try {
            return appendLock.tryLock(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long toMillis(long nanos) {
        return TimeUnit.NANOSECONDS.toMillis(nanos);
    }
}
