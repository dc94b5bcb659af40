package com.wpanther.kmscert.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Selects and configures the signing handle used to sign the certificate.
 * Without a PKCS#11 label the KMS Sign API is called directly.
 */
@Value
@Builder
public class SigningEngineSettings {

    public static final SigningEngineSettings KMS_API = SigningEngineSettings.builder().build();

    /**
     * Token label of the key when signing through a PKCS#11 module
     */
    String pkcs11Label;

    /**
     * SunPKCS11 configuration file; generated from the library path when absent
     */
    String pkcs11ConfigFile;

    boolean debug;

    public boolean usesPkcs11() {
        return pkcs11Label != null && !pkcs11Label.isBlank();
    }
}
