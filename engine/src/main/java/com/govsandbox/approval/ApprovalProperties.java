package com.govsandbox.approval;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Approval handshake limits. A request unresolved after {@code timeout} is rejected;
 * resolved requests stay queryable for {@code retention}.
 */
@ConfigurationProperties(prefix = "sandbox.approval")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ApprovalProperties {

    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    @NotNull
    private Duration retention = Duration.ofHours(24);
}
