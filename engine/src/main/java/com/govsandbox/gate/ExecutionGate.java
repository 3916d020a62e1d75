package com.govsandbox.gate;

import com.govsandbox.audit.HashChainedAuditLog;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.ExecutionMode;
import com.govsandbox.domain.PayloadKeys;
import com.govsandbox.domain.TransactionIntent;
import com.govsandbox.gate.GateDecision.Verdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Classifies transaction intents by execution mode and owns the audited mode transitions.
 * Never touches the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionGate {

    private final ExecutionModeState modeState;
    private final GateProperties properties;
    private final PromotionApprovalVerifier approvalVerifier;
    private final HashChainedAuditLog auditLog;

    public ExecutionMode currentMode() {
        return modeState.current();
    }

    public GateDecision authorize(TransactionIntent intent) {
        return withDecision(intent, Function.identity());
    }

    /**
     * Classifies {@code intent} and runs {@code action} on the decision while the mode stays pinned,
     * so a concurrent {@link #promote} waits for the whole unit.
     */
    public <T> T withDecision(TransactionIntent intent, Function<GateDecision, T> action) {
        return modeState.withModeRead(mode -> action.apply(classify(intent, mode)));
    }

    /**
     * Runs {@code action} with the mode pinned. Callers that also take ledger locks must enter here first;
     * the mode lock is always the outer one.
     */
    public <T> T withModePinned(Function<ExecutionMode, T> action) {
        return modeState.withModeRead(action);
    }

    /**
     * Moves exactly one tier up. Requires a valid, unused {@link PromotionApproval} for this transition.
     * The outcome is witnessed at LAW_TIER either way; on refusal the mode is unchanged.
     *
     * @throws SandboxException UNAUTHORIZED_PROMOTION
     */
    public ExecutionMode promote(ExecutionMode targetMode, PromotionApproval approval, String actor) {
        if (actor == null || actor.isBlank()) {
            throw new SandboxException(ErrorKind.INVALID_INPUT, "Promotion actor must not be blank");
        }
        return modeState.transition(current -> {
            try {
                if (targetMode == null || current.next().filter(targetMode::equals).isEmpty()) {
                    throw new SandboxException(ErrorKind.UNAUTHORIZED_PROMOTION,
                            "Promotion not authorized: " + current + " -> " + targetMode + " is not a single-tier step up");
                }
                approvalVerifier.verifyAndConsume(approval, current, targetMode);
            } catch (SandboxException e) {
                witnessRefusal(current, targetMode, actor, e);
                throw e;
            }
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put(PayloadKeys.FROM_MODE, current.name());
            payload.put(PayloadKeys.TARGET_MODE, targetMode.name());
            payload.put(PayloadKeys.APPROVER_ID, approval.approverId());
            auditLog.witness(AuditEventKind.MODE_PROMOTED, actor, payload, ComplianceTier.LAW_TIER);
            log.info("Execution mode promoted {} -> {} by {} (approver {})", current, targetMode, actor, approval.approverId());
            return targetMode;
        });
    }

    private GateDecision classify(TransactionIntent intent, ExecutionMode mode) {
        BigDecimal amount = intent.amount();
        return switch (mode) {
            case SHADOW -> new GateDecision(Verdict.SIMULATE, mode, "shadow mode never commits");
            case PILOT -> thresholdDecision(mode, amount, properties.getPilotApprovalThreshold());
            case PRODUCTION -> thresholdDecision(mode, amount, properties.getProductionApprovalThreshold());
        };
    }

    private static GateDecision thresholdDecision(ExecutionMode mode, BigDecimal amount, BigDecimal threshold) {
        if (amount.compareTo(threshold) > 0) {
            return new GateDecision(Verdict.REQUIRE_APPROVAL, mode,
                    "amount " + amount.toPlainString() + " above " + mode + " threshold " + threshold.toPlainString());
        }
        return new GateDecision(Verdict.COMMIT, mode, "within " + mode + " threshold");
    }

    private void witnessRefusal(ExecutionMode current, ExecutionMode targetMode, String actor, SandboxException cause) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.VIOLATION, ErrorKind.UNAUTHORIZED_PROMOTION.name());
        payload.put(PayloadKeys.FROM_MODE, current.name());
        payload.put(PayloadKeys.TARGET_MODE, String.valueOf(targetMode));
        payload.put(PayloadKeys.DETAIL, cause.getMessage());
        auditLog.witness(AuditEventKind.COMPLIANCE_VIOLATION, actor, payload, ComplianceTier.LAW_TIER);
        log.warn("Promotion {} -> {} refused for {}: {}", current, targetMode, actor, cause.getMessage());
    }
}
