package com.govsandbox.evidence;

import com.govsandbox.domain.ComplianceTier;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Evidence record settings. Periodic sealing is off unless {@code auto-seal-enabled} is set.
 */
@ConfigurationProperties(prefix = "sandbox.evidence")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class EvidenceProperties {

    private boolean autoSealEnabled = false;

    /** Delay (ms) between sealing runs of EvidenceSealingJob. */
    @Min(1000)
    private long sealIntervalMs = 60_000;

    /** Compliance tier each record attests to. */
    @NotNull
    private ComplianceTier attestation = ComplianceTier.LAW_TIER;
}
