package com.govsandbox.evidence;

import com.govsandbox.common.SandboxException;
import com.govsandbox.config.SchedulerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically seals the not-yet-sealed span of the audit log. A failed run is logged and retried on the
 * next tick; an integrity violation stays visible in the log at error level.
 */
@Component
@ConditionalOnProperty(name = "sandbox.evidence.auto-seal-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class EvidenceSealingJob {

    private final EvidenceRecordBuilder recordBuilder;

    @Scheduled(
            fixedDelayString = "${sandbox.evidence.seal-interval-ms:60000}",
            initialDelayString = "${sandbox.evidence.seal-interval-ms:60000}",
            scheduler = SchedulerConfig.SCHEDULER_POOL)
    public void sealPending() {
        try {
            recordBuilder.sealPendingSpan()
                    .ifPresent(r -> log.debug("Scheduled seal produced {}", r.recordId()));
        } catch (SandboxException e) {
            log.error("Scheduled evidence sealing failed ({}): {}", e.getKind(), e.getMessage());
        }
    }
}
