package com.govsandbox.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Append-only store selection. {@code mongo} keeps the audit chain and evidence records across restarts.
 */
@ConfigurationProperties(prefix = "sandbox.store")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class StoreProperties {

    public enum StoreType {
        MEMORY,
        MONGO
    }

    @NotNull
    private StoreType type = StoreType.MEMORY;

    @NotBlank
    private String mongoUri = "mongodb://localhost:27017";

    @NotBlank
    private String database = "governance_sandbox";
}
