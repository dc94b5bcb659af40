package com.wpanther.kmscert.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

/**
 * Everything needed for one certificate issuance run
 */
@Value
@Builder
public class IssuanceRequest {

    public static final String DEFAULT_DESTINATION = "file:self_signed_certificate.pem";

    @NotBlank(message = "KMS key ID is required")
    String kmsKeyId;

    @Valid
    @NotNull(message = "Certificate details are required")
    CertificateRequest certificateRequest;

    @Builder.Default
    @NotBlank(message = "Output destination is required")
    String destination = DEFAULT_DESTINATION;

    /**
     * Fail before signing unless the key is an RSA key
     */
    boolean requireRsa;

    @Builder.Default
    SigningEngineSettings engineSettings = SigningEngineSettings.KMS_API;
}
