package com.govsandbox.signature;

import org.bouncycastle.jcajce.spec.MLDSAParameterSpec;

/**
 * ML-DSA parameter sets. ML_DSA_65 is the 192-bit security category and the default.
 */
public enum MlDsaParameterSet {
    ML_DSA_44(MLDSAParameterSpec.ml_dsa_44),
    ML_DSA_65(MLDSAParameterSpec.ml_dsa_65),
    ML_DSA_87(MLDSAParameterSpec.ml_dsa_87);

    private final MLDSAParameterSpec spec;

    MlDsaParameterSet(MLDSAParameterSpec spec) {
        this.spec = spec;
    }

    MLDSAParameterSpec spec() {
        return spec;
    }
}
