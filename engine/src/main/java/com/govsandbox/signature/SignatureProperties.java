package com.govsandbox.signature;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Witness signing identity. The keypair itself is generated in-process at startup and never configured.
 */
@ConfigurationProperties(prefix = "sandbox.signature")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SignatureProperties {

    /** Identifier recorded as signer on evidence records. */
    @NotBlank
    private String signerId = "IG-WITNESS";

    @NotNull
    private MlDsaParameterSet parameterSet = MlDsaParameterSet.ML_DSA_65;

    /**
     * Base64 X.509 public keys of earlier processes. Events they signed still verify after a restart
     * against a durable store.
     */
    private List<String> trustedPublicKeys = new ArrayList<>();
}
