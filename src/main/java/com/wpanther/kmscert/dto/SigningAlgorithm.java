package com.wpanther.kmscert.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import software.amazon.awssdk.services.kms.model.SigningAlgorithmSpec;

/**
 * Signature algorithms a certificate can be issued with. Each constant ties the
 * KMS signing algorithm to its JCA name and the digest computed before signing.
 */
@Getter
@RequiredArgsConstructor
public enum SigningAlgorithm {

    RSA_PKCS1_SHA_256(SigningAlgorithmSpec.RSASSA_PKCS1_V1_5_SHA_256, "SHA256withRSA", "SHA-256"),
    ECDSA_SHA_256(SigningAlgorithmSpec.ECDSA_SHA_256, "SHA256withECDSA", "SHA-256"),
    ECDSA_SHA_384(SigningAlgorithmSpec.ECDSA_SHA_384, "SHA384withECDSA", "SHA-384"),
    ECDSA_SHA_512(SigningAlgorithmSpec.ECDSA_SHA_512, "SHA512withECDSA", "SHA-512");

    private final SigningAlgorithmSpec kmsAlgorithm;
    private final String jcaName;
    private final String digestAlgorithm;
}
