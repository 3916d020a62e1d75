package com.govsandbox.gate;

import com.govsandbox.audit.HashChainedAuditLog;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.PayloadKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Operator-controlled halt flag. Asserting sets the flag before witnessing, clearing witnesses before
 * lowering it, so a failed witness always leaves the sandbox halted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmergencyStopSwitch implements HaltSignal {

    private final HashChainedAuditLog auditLog;
    private volatile boolean halted;

    @Override
    public boolean isHalted() {
        return halted;
    }

    /**
     * @return false if already halted (nothing witnessed)
     */
    public synchronized boolean trigger(String actor, String reason) {
        if (halted) {
            return false;
        }
        halted = true;
        auditLog.witness(AuditEventKind.EMERGENCY_STOP_TRIGGERED, actor,
                Map.of(PayloadKeys.REASON, String.valueOf(reason)), ComplianceTier.LAW_TIER);
        log.warn("EMERGENCY STOP asserted by {}: {}", actor, reason);
        return true;
    }

    /**
     * @return false if not halted (nothing witnessed)
     */
    public synchronized boolean clear(String actor, String reason) {
        if (!halted) {
            return false;
        }
        auditLog.witness(AuditEventKind.EMERGENCY_STOP_CLEARED, actor,
                Map.of(PayloadKeys.REASON, String.valueOf(reason)), ComplianceTier.LAW_TIER);
        halted = false;
        log.info("Emergency stop cleared by {}: {}", actor, reason);
        return true;
    }
}
