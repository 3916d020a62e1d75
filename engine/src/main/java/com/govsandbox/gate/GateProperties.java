package com.govsandbox.gate;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution gate thresholds and the external approvers allowed to sign promotion tokens.
 */
@ConfigurationProperties(prefix = "sandbox.gate")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class GateProperties {

    /** PILOT transfers above this amount need approval. 0 routes every PILOT commit through approval. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal pilotApprovalThreshold = BigDecimal.ZERO;

    /** PRODUCTION transfers above this amount need approval. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal productionApprovalThreshold = new BigDecimal("10000.00");

    /** Promotion tokens issued further than this from now (either direction) are rejected. */
    @NotNull
    private Duration promotionTokenTtl = Duration.ofMinutes(15);

    /** Approver id to Base64 X.509 ML-DSA public key. */
    private Map<String, String> approvers = new LinkedHashMap<>();
}
