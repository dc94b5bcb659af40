package com.wpanther.kmscert.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of comparing a certificate's public key with a reference key
 */
@Value
@Builder
public class VerificationResult {

    boolean match;

    String certificatePublicKeyPem;

    String referencePublicKeyPem;

    /**
     * Where the reference key came from, e.g. the KMS key ID or the key file path
     */
    String reference;
}
