package com.wpanther.kmscert.service;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.wpanther.kmscert.dto.IssuanceRequest;
import com.wpanther.kmscert.dto.KeyDescriptor;
import com.wpanther.kmscert.dto.SigningAlgorithm;
import com.wpanther.kmscert.exception.InputValidationException;
import com.wpanther.kmscert.exception.SinkWriteException;
import com.wpanther.kmscert.output.DestinationParser;
import com.wpanther.kmscert.output.OutputSinkService;
import com.wpanther.kmscert.output.SinkTarget;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues a self-signed certificate for a KMS key and writes it to its destination
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CertificateIssuanceService {

    private final AWSKMSService kmsService;
    private final KeySpecResolver keySpecResolver;
    private final SigningHandleFactory signingHandleFactory;
    private final SelfSignedCertificateBuilder certificateBuilder;
    private final DestinationParser destinationParser;
    private final OutputSinkService outputSinkService;
    private final Validator validator;

    /**
     * Runs the issuance pipeline: describe key, resolve algorithm, fetch the
     * public key, sign the certificate, write it
     *
     * @param request The issuance parameters
     * @return The issued certificate as PEM text
     */
    public String issue(IssuanceRequest request) {
        validate(request);
        SinkTarget target = destinationParser.parse(request.getDestination());

        String keyId = request.getKmsKeyId();
        KeyDescriptor descriptor = kmsService.describeKey(keyId);
        SigningAlgorithm algorithm = keySpecResolver.resolve(descriptor);
        keySpecResolver.checkCompatibility(descriptor, request.isRequireRsa());
        if (!descriptor.isEnabled()) {
            log.warn("KMS key {} is not enabled; signing is expected to fail", keyId);
        }
        log.info("Issuing certificate with KMS key {} ({}, {})", keyId, descriptor.getKeySpec(), algorithm.getJcaName());

        byte[] publicKey = kmsService.getPublicKey(keyId);

        String certificatePem;
        try (SigningHandle handle = signingHandleFactory.open(keyId, algorithm, request.getEngineSettings())) {
            certificatePem = certificateBuilder.build(request.getCertificateRequest(), publicKey,
                handle.getContentSigner());
        }

        try {
            outputSinkService.write(target, certificatePem);
        } catch (SinkWriteException e) {
            // The signature cannot be recreated for free, so keep the certificate in the log
            log.warn("Certificate could not be written to {}; issued certificate follows:\n{}",
                target.getKind(), certificatePem);
            throw e;
        }
        return certificatePem;
    }

    private void validate(IssuanceRequest request) {
        Set<ConstraintViolation<IssuanceRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining("; "));
            throw new InputValidationException(message);
        }
    }
}
