package com.govsandbox.audit;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Hash chain and witness latency settings. The genesis digest is a fixed constant so the chain
 * re-verifies identically across restarts; it must never be derived from the clock.
 */
@ConfigurationProperties(prefix = "sandbox.audit")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class AuditProperties {

    /** SHA3-256("GOVERNANCE_SANDBOX_AUDIT_GENESIS_V1"), lowercase hex. */
    public static final String DEFAULT_GENESIS_DIGEST =
            "ba292c32c4fb02bde5e87aa24f53cac7bc89cff272f3f047512a979b3ca63435";

    @NotNull
    @Pattern(regexp = "[0-9a-f]{64}", message = "genesis digest must be 64 lowercase hex chars")
    private String genesisDigest = DEFAULT_GENESIS_DIGEST;

    /** Witness latency above this is logged as a warning. */
    @NotNull
    private Duration softLatency = Duration.ofMillis(50);

    /** Witness latency above this fails the triggering operation after recording a compliance violation. */
    @NotNull
    private Duration hardLatency = Duration.ofMillis(500);
}
