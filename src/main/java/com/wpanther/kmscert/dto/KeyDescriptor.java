package com.wpanther.kmscert.dto;

import lombok.Builder;
import lombok.Value;
import software.amazon.awssdk.services.kms.model.KeySpec;
import software.amazon.awssdk.services.kms.model.KeyUsageType;

/**
 * Cryptographic parameters of a KMS key, as reported by DescribeKey
 */
@Value
@Builder
public class KeyDescriptor {

    /**
     * The key ID, alias or ARN the caller supplied
     */
    String keyId;

    /**
     * The Amazon Resource Name (ARN) of the KMS key
     */
    String keyArn;

    /**
     * The key spec (e.g., RSA_2048, ECC_NIST_P256)
     */
    KeySpec keySpec;

    KeyUsageType keyUsage;

    boolean enabled;

    public boolean isRsa() {
        return keySpec != null && keySpec.toString().startsWith("RSA");
    }
}
