package com.wpanther.kmscert.dto;

import java.util.List;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Subject, extensions and validity of a certificate to be issued
 */
@Value
@Builder
public class CertificateRequest {

    public static final int DEFAULT_VALIDITY_DAYS = 9125;
    public static final long DEFAULT_SERIAL = 1L;

    @NotBlank(message = "Certificate common name is required")
    String commonName;

    @Size(min = 2, max = 2, message = "Country must be a two-letter code")
    String country;

    String state;

    String locality;

    String organization;

    String organizationalUnit;

    String emailAddress;

    /**
     * DNS names for the subjectAltName extension, in emission order
     */
    @Singular
    List<@NotBlank(message = "Subject alternative names must not be blank") String> subjectAlternativeNames;

    @Builder.Default
    @Min(value = 1, message = "Validity must be at least one day")
    int validityDays = DEFAULT_VALIDITY_DAYS;

    @Builder.Default
    @Min(value = 1, message = "Certificate serial must be at least 1")
    long serial = DEFAULT_SERIAL;

    boolean certificateAuthority;
}
