package com.govsandbox.gate;

import com.govsandbox.SandboxFixture;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.ExecutionMode;
import com.govsandbox.domain.PayloadKeys;
import com.govsandbox.domain.TransactionIntent;
import com.govsandbox.gate.GateDecision.Verdict;
import com.govsandbox.signature.MlDsaSignatureAuthority;
import com.govsandbox.signature.SignatureProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionGateTest {

    private SandboxFixture sandbox;
    private ExecutionGate gate;

    @BeforeEach
    void setUp() {
        sandbox = SandboxFixture.create();
        gate = sandbox.gate;
    }

    private static TransactionIntent intent(String amount) {
        return new TransactionIntent("TX-1", "tester", "A", "B", new BigDecimal(amount), "USD");
    }

    private void assertRefused(Runnable promotion) {
        long before = sandbox.auditLog.size();
        assertThatThrownBy(promotion::run)
                .isInstanceOf(SandboxException.class)
                .satisfies(e -> assertThat(((SandboxException) e).getKind()).isEqualTo(ErrorKind.UNAUTHORIZED_PROMOTION));
        assertThat(sandbox.auditLog.size()).isEqualTo(before + 1);
        AuditEvent violation = sandbox.auditLog.latest(1).get(0);
        assertThat(violation.kind()).isEqualTo(AuditEventKind.COMPLIANCE_VIOLATION);
        assertThat(violation.tier()).isEqualTo(ComplianceTier.LAW_TIER);
        assertThat(violation.payloadValue(PayloadKeys.VIOLATION)).isEqualTo("UNAUTHORIZED_PROMOTION");
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("gate starts in SHADOW and simulates any amount")
    void shadowSimulates() {
        assertThat(gate.currentMode()).isEqualTo(ExecutionMode.SHADOW);
        assertThat(gate.authorize(intent("1000000")).verdict()).isEqualTo(Verdict.SIMULATE);
    }

    @Test
    @DisplayName("promotion without a token is refused, witnessed at LAW_TIER, and the mode is unchanged")
    void promotionWithoutToken() {
        assertRefused(() -> gate.promote(ExecutionMode.PILOT, null, "operator"));

        assertThat(gate.currentMode()).isEqualTo(ExecutionMode.SHADOW);
    }

    @Test
    @DisplayName("skipping a tier is refused even with a token for that jump")
    void skipTierRefused() {
        PromotionApproval token = sandbox.approvalToken(ExecutionMode.SHADOW, ExecutionMode.PRODUCTION);

        assertRefused(() -> gate.promote(ExecutionMode.PRODUCTION, token, "operator"));
        assertThat(gate.currentMode()).isEqualTo(ExecutionMode.SHADOW);
    }

    @Test
    @DisplayName("valid token promotes one tier and witnesses MODE_PROMOTED")
    void validPromotion() {
        ExecutionMode result = gate.promote(ExecutionMode.PILOT,
                sandbox.approvalToken(ExecutionMode.SHADOW, ExecutionMode.PILOT), "operator");

        assertThat(result).isEqualTo(ExecutionMode.PILOT);
        assertThat(gate.currentMode()).isEqualTo(ExecutionMode.PILOT);
        AuditEvent promoted = sandbox.auditLog.latest(1).get(0);
        assertThat(promoted.kind()).isEqualTo(AuditEventKind.MODE_PROMOTED);
        assertThat(promoted.tier()).isEqualTo(ComplianceTier.LAW_TIER);
        assertThat(promoted.payloadValue(PayloadKeys.APPROVER_ID)).isEqualTo(SandboxFixture.APPROVER_ID);
        assertThat(promoted.payloadValue(PayloadKeys.TARGET_MODE)).isEqualTo("PILOT");
    }

    @Test
    @DisplayName("no promotion beyond PRODUCTION")
    void nothingAboveProduction() {
        sandbox.promoteTo(ExecutionMode.PRODUCTION);

        assertRefused(() -> gate.promote(ExecutionMode.PRODUCTION,
                sandbox.approvalToken(ExecutionMode.PRODUCTION, ExecutionMode.PRODUCTION), "operator"));
        assertThat(gate.currentMode()).isEqualTo(ExecutionMode.PRODUCTION);
    }

    @Test
    @DisplayName("a token cannot be replayed")
    void replayRefused() {
        PromotionApproval token = sandbox.approvalToken(ExecutionMode.SHADOW, ExecutionMode.PILOT);
        gate.promote(ExecutionMode.PILOT, token, "operator");

        assertThatThrownBy(() -> sandbox.promotionVerifier.verifyAndConsume(token, ExecutionMode.SHADOW, ExecutionMode.PILOT))
                .isInstanceOf(SandboxException.class)
                .hasMessageContaining("already used");
    }

    @Test
    @DisplayName("expired, unregistered and forged tokens are refused")
    void invalidTokensRefused() {
        PromotionApproval expired = SandboxFixture.signedToken(SandboxFixture.APPROVER_ID, sandbox.approver,
                ExecutionMode.SHADOW, ExecutionMode.PILOT, sandbox.clock.millis());
        sandbox.clock.advance(Duration.ofMinutes(16));
        assertRefused(() -> gate.promote(ExecutionMode.PILOT, expired, "operator"));

        MlDsaSignatureAuthority stranger = new MlDsaSignatureAuthority(new SignatureProperties(), sandbox.verifier);
        assertThat(sandbox.promotionVerifier.isRegistered("IG-STRANGER")).isFalse();
        PromotionApproval unregistered = SandboxFixture.signedToken("IG-STRANGER", stranger,
                ExecutionMode.SHADOW, ExecutionMode.PILOT, sandbox.clock.millis());
        assertRefused(() -> gate.promote(ExecutionMode.PILOT, unregistered, "operator"));

        PromotionApproval forged = SandboxFixture.signedToken(SandboxFixture.APPROVER_ID, stranger,
                ExecutionMode.SHADOW, ExecutionMode.PILOT, sandbox.clock.millis());
        assertRefused(() -> gate.promote(ExecutionMode.PILOT, forged, "operator"));

        assertThat(gate.currentMode()).isEqualTo(ExecutionMode.SHADOW);
        assertThat(sandbox.auditLog.verifyChain()).isTrue();
    }

    @Test
    @DisplayName("blank actor is invalid input and witnesses nothing")
    void blankActor() {
        assertThatThrownBy(() -> gate.promote(ExecutionMode.PILOT,
                sandbox.approvalToken(ExecutionMode.SHADOW, ExecutionMode.PILOT), ""))
                .isInstanceOf(SandboxException.class)
                .satisfies(e -> assertThat(((SandboxException) e).getKind()).isEqualTo(ErrorKind.INVALID_INPUT));
        assertThat(sandbox.auditLog.size()).isZero();
    }

    @Test
    @DisplayName("PILOT routes everything above its threshold to approval; PRODUCTION commits up to its threshold")
    void thresholds() {
        sandbox.promoteTo(ExecutionMode.PILOT);
        assertThat(gate.authorize(intent("0.01")).verdict()).isEqualTo(Verdict.REQUIRE_APPROVAL);

        sandbox.promoteTo(ExecutionMode.PRODUCTION);
        assertThat(gate.authorize(intent("10000.00")).verdict()).isEqualTo(Verdict.COMMIT);
        GateDecision large = gate.authorize(intent("10000.01"));
        assertThat(large.verdict()).isEqualTo(Verdict.REQUIRE_APPROVAL);
        assertThat(large.mode()).isEqualTo(ExecutionMode.PRODUCTION);
    }

    @Test
    @DisplayName("promote waits for an in-flight decision unit and the unit keeps the mode it was decided under")
    void promotionSerializedWithDecisions() throws Exception {
        PromotionApproval token = sandbox.approvalToken(ExecutionMode.SHADOW, ExecutionMode.PILOT);
        CountDownLatch decided = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Verdict> inFlight = pool.submit(() -> gate.withDecision(intent("10"), decision -> {
                decided.countDown();
                awaitUninterruptibly(release);
                return decision.verdict();
            }));
            assertThat(decided.await(5, TimeUnit.SECONDS)).isTrue();

            Future<ExecutionMode> promotion = pool.submit(() -> gate.promote(ExecutionMode.PILOT, token, "operator"));

            assertThatThrownBy(() -> promotion.get(300, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
            assertThat(sandbox.auditLog.size()).isZero();

            release.countDown();

            assertThat(inFlight.get(5, TimeUnit.SECONDS)).isEqualTo(Verdict.SIMULATE);
            assertThat(promotion.get(5, TimeUnit.SECONDS)).isEqualTo(ExecutionMode.PILOT);
            assertThat(sandbox.auditLog.latest(1).get(0).kind()).isEqualTo(AuditEventKind.MODE_PROMOTED);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}
