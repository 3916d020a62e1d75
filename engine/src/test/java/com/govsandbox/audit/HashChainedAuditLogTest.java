package com.govsandbox.audit;

import com.govsandbox.MutableClock;
import com.govsandbox.SandboxFixture;
import com.govsandbox.audit.ChainIntegrityViolationException.BreakType;
import com.govsandbox.common.Digests;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.PayloadKeys;
import com.govsandbox.signature.MlDsaSignatureAuthority;
import com.govsandbox.signature.MlDsaVerifier;
import com.govsandbox.signature.SignatureProperties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashChainedAuditLogTest {

    private static MlDsaVerifier verifier;
    private static MlDsaSignatureAuthority authority;

    private MutableClock clock;
    private TamperableAuditEventStore store;
    private AuditProperties properties;
    private HashChainedAuditLog auditLog;

    @BeforeAll
    static void keys() {
        verifier = new MlDsaVerifier();
        authority = new MlDsaSignatureAuthority(new SignatureProperties(), verifier);
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T00:00:00Z"));
        store = new TamperableAuditEventStore();
        properties = new AuditProperties();
        auditLog = new HashChainedAuditLog(store, authority, properties, clock);
    }

    private AuditEvent witness(String detail) {
        return auditLog.witness(AuditEventKind.ACCOUNT_FUNDED, "tester", Map.of(PayloadKeys.DETAIL, detail),
                ComplianceTier.INFORMATIONAL_TIER);
    }

    @Test
    @DisplayName("empty log verifies and its head is the genesis constant")
    void emptyChainVerifies() {
        assertThat(auditLog.verifyChain()).isTrue();
        assertThat(auditLog.size()).isZero();
        assertThat(auditLog.headDigest()).isEqualTo(AuditProperties.DEFAULT_GENESIS_DIGEST);
    }

    @Test
    @DisplayName("each entry links to its predecessor, starting from genesis, and the chain verifies")
    void entriesAreChained() {
        AuditEvent first = witness("one");
        AuditEvent second = witness("two");
        AuditEvent third = witness("three");

        assertThat(first.index()).isZero();
        assertThat(first.previousDigest()).isEqualTo(auditLog.genesisDigest());
        assertThat(second.previousDigest()).isEqualTo(first.digest());
        assertThat(third.previousDigest()).isEqualTo(second.digest());
        assertThat(auditLog.headDigest()).isEqualTo(third.digest());
        assertThat(third.eventId()).isEqualTo("AE-0000000002");
        assertThat(third.signerKeyId()).isEqualTo(authority.keyId());
        assertThat(auditLog.verifyChain()).isTrue();
        assertThat(auditLog.verifyChain(1, 3)).isTrue();
    }

    @Test
    @DisplayName("digest is reproducible: same content and genesis give the same digest in a fresh log")
    void digestReproducibleAcrossInstances() {
        AuditEvent original = witness("same");

        HashChainedAuditLog other = new HashChainedAuditLog(new TamperableAuditEventStore(), authority, new AuditProperties(), clock);
        AuditEvent replay = other.witness(AuditEventKind.ACCOUNT_FUNDED, "tester", Map.of(PayloadKeys.DETAIL, "same"),
                ComplianceTier.INFORMATIONAL_TIER);

        assertThat(replay.digest()).isEqualTo(original.digest());
    }

    @Test
    @DisplayName("edited payload is detected as DIGEST_MISMATCH at that index")
    void payloadEditDetected() {
        witness("one");
        AuditEvent second = witness("two");
        witness("three");
        store.replace(1, second.toBuilder().payload(Map.of(PayloadKeys.DETAIL, "forged")).build());

        assertThatThrownBy(() -> auditLog.verifyChain())
                .isInstanceOf(ChainIntegrityViolationException.class)
                .satisfies(e -> {
                    ChainIntegrityViolationException violation = (ChainIntegrityViolationException) e;
                    assertThat(violation.getBrokenIndex()).isEqualTo(1);
                    assertThat(violation.getBreakType()).isEqualTo(BreakType.DIGEST_MISMATCH);
                    assertThat(violation.getKind()).isEqualTo(ErrorKind.CHAIN_INTEGRITY_VIOLATION);
                });
    }

    @Test
    @DisplayName("recomputed digest without re-signing is caught by the signature check")
    void rehashedEntryFailsSignature() {
        witness("one");
        AuditEvent second = witness("two");
        AuditEvent forged = second.toBuilder().actor("mallory").build();
        forged = forged.toBuilder().digest(forged.computeDigest()).build();
        store.replace(1, forged);

        assertThatThrownBy(() -> auditLog.verifyChain(0, 2))
                .isInstanceOf(ChainIntegrityViolationException.class)
                .satisfies(e -> assertThat(((ChainIntegrityViolationException) e).getBreakType()).isEqualTo(BreakType.SIGNATURE_INVALID));
    }

    @Test
    @DisplayName("rewritten predecessor breaks the following link")
    void rewrittenPredecessorBreaksLink() {
        AuditEvent first = witness("one");
        witness("two");
        AuditEvent rewritten = first.toBuilder().actor("mallory").build();
        rewritten = rewritten.toBuilder()
                .digest(rewritten.computeDigest())
                .signature(Base64.getEncoder().encodeToString(authority.sign(Digests.fromHex(rewritten.computeDigest()))))
                .build();
        store.replace(0, rewritten);

        assertThatThrownBy(() -> auditLog.verifyChain())
                .isInstanceOf(ChainIntegrityViolationException.class)
                .satisfies(e -> {
                    ChainIntegrityViolationException violation = (ChainIntegrityViolationException) e;
                    assertThat(violation.getBrokenIndex()).isEqualTo(1);
                    assertThat(violation.getBreakType()).isEqualTo(BreakType.LINK_MISMATCH);
                });
    }

    @Test
    @DisplayName("truncated store is reported as a sequence gap")
    void truncationDetected() {
        witness("one");
        witness("two");
        store.removeLast();

        assertThatThrownBy(() -> auditLog.verifyChain())
                .isInstanceOf(ChainIntegrityViolationException.class)
                .satisfies(e -> assertThat(((ChainIntegrityViolationException) e).getBreakType()).isEqualTo(BreakType.SEQUENCE_GAP));
    }

    @Test
    @DisplayName("timestamps never decrease when the wall clock moves backwards")
    void timestampsMonotonic() {
        AuditEvent first = witness("one");
        clock.advance(Duration.ofMinutes(-10));
        AuditEvent second = witness("two");
        clock.advance(Duration.ofMinutes(20));
        AuditEvent third = witness("three");

        assertThat(second.timestampMs()).isEqualTo(first.timestampMs());
        assertThat(third.timestampMs()).isGreaterThan(second.timestampMs());
        assertThat(auditLog.verifyChain()).isTrue();
    }

    @Test
    @DisplayName("a new log over an existing store resumes head, index and timestamps")
    void resumesFromStore() {
        witness("one");
        AuditEvent second = witness("two");

        HashChainedAuditLog resumed = new HashChainedAuditLog(store, authority, properties, clock);
        AuditEvent third = resumed.witness(AuditEventKind.ACCOUNT_FUNDED, "tester", Map.of(), ComplianceTier.INFORMATIONAL_TIER);

        assertThat(resumed.size()).isEqualTo(3);
        assertThat(third.index()).isEqualTo(2);
        assertThat(third.previousDigest()).isEqualTo(second.digest());
        assertThat(resumed.verifyChain()).isTrue();
    }

    @Test
    @DisplayName("entries signed by an unknown key fail closed; a trusted key makes them verify again")
    void unknownSignerKeyFailsClosed() {
        witness("one");
        MlDsaSignatureAuthority restartedAuthority = new MlDsaSignatureAuthority(new SignatureProperties(), verifier);
        HashChainedAuditLog restarted = new HashChainedAuditLog(store, restartedAuthority, properties, clock);

        assertThatThrownBy(restarted::verifyChain)
                .isInstanceOf(ChainIntegrityViolationException.class)
                .satisfies(e -> assertThat(((ChainIntegrityViolationException) e).getBreakType()).isEqualTo(BreakType.UNKNOWN_SIGNER_KEY));

        SignatureProperties trusting = new SignatureProperties();
        trusting.setTrustedPublicKeys(List.of(Base64.getEncoder().encodeToString(authority.publicKey())));
        HashChainedAuditLog trusted = new HashChainedAuditLog(store,
                new MlDsaSignatureAuthority(trusting, verifier), properties, clock);
        trusted.witness(AuditEventKind.ACCOUNT_FUNDED, "tester", Map.of(), ComplianceTier.INFORMATIONAL_TIER);
        assertThat(trusted.verifyChain()).isTrue();
    }

    @Test
    @DisplayName("exceeding the hard latency cap records a compliance violation instead of the event, then fails")
    void hardLatencyCapRecordsViolation() {
        properties.setHardLatency(Duration.ZERO);
        HashChainedAuditLog strict = new HashChainedAuditLog(store, authority, properties, clock);

        assertThatThrownBy(() -> strict.witness(AuditEventKind.TRANSACTION_SIMULATION, "tester", Map.of(),
                ComplianceTier.INFORMATIONAL_TIER))
                .isInstanceOf(SandboxException.class)
                .satisfies(e -> assertThat(((SandboxException) e).getKind()).isEqualTo(ErrorKind.LATENCY_CAP_EXCEEDED));

        assertThat(strict.size()).isEqualTo(1);
        AuditEvent violation = strict.latest(1).get(0);
        assertThat(violation.kind()).isEqualTo(AuditEventKind.COMPLIANCE_VIOLATION);
        assertThat(violation.tier()).isEqualTo(ComplianceTier.LAW_TIER);
        assertThat(violation.payloadValue(PayloadKeys.ATTEMPTED_KIND)).isEqualTo("TRANSACTION_SIMULATION");
        assertThat(violation.payloadValue(PayloadKeys.VIOLATION)).isEqualTo("LATENCY_CAP_EXCEEDED");
        assertThat(strict.verifyChain()).isTrue();
    }

    @Test
    @DisplayName("blank actor is rejected before anything is appended")
    void blankActorRejected() {
        assertThatThrownBy(() -> auditLog.witness(AuditEventKind.ACCOUNT_FUNDED, " ", Map.of(), ComplianceTier.INFORMATIONAL_TIER))
                .isInstanceOf(SandboxException.class)
                .satisfies(e -> assertThat(((SandboxException) e).getKind()).isEqualTo(ErrorKind.INVALID_INPUT));
        assertThat(auditLog.size()).isZero();
    }

    @Test
    @DisplayName("out-of-bounds verification range is invalid input")
    void invalidRange() {
        witness("one");

        assertThatThrownBy(() -> auditLog.verifyChain(0, 2))
                .isInstanceOf(SandboxException.class)
                .satisfies(e -> assertThat(((SandboxException) e).getKind()).isEqualTo(ErrorKind.INVALID_INPUT));
    }

    @Test
    @DisplayName("concurrent witnesses produce a dense, unbroken chain with unique ids")
    void concurrentAppends() throws Exception {
        int threads = 8;
        int perThread = 5;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int worker = t;
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        witness("w" + worker + "-" + i);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            workers.add(thread);
            thread.start();
        }
        start.countDown();
        for (Thread thread : workers) {
            thread.join();
        }

        List<AuditEvent> events = auditLog.range(0, auditLog.size());
        Set<String> ids = new HashSet<>();
        events.forEach(e -> ids.add(e.eventId()));
        assertThat(events).hasSize(threads * perThread);
        assertThat(ids).hasSize(threads * perThread);
        assertThat(auditLog.verifyChain()).isTrue();
    }

    @Test
    @DisplayName("the first witness of a freshly wired sandbox stays within the default hard cap")
    void firstWitnessWithinDefaultCap() {
        SandboxFixture fresh = SandboxFixture.create();
        assertThat(fresh.auditProperties.getHardLatency()).isEqualTo(Duration.ofMillis(500));
        assertThat(fresh.auditLog.size()).isZero();

        fresh.engine.createAccount("treasury", "ACC-A", new BigDecimal("500.00"), "USD");

        assertThat(fresh.auditLog.size()).isEqualTo(1);
        assertThat(fresh.auditLog.get(0)).hasValueSatisfying(event -> {
            assertThat(event.kind()).isEqualTo(AuditEventKind.ACCOUNT_FUNDED);
            assertThat(event.index()).isZero();
            assertThat(event.previousDigest()).isEqualTo(fresh.auditLog.genesisDigest());
        });
    }
}
