package com.wpanther.kmscert.service;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.dto.SigningAlgorithm;
import com.wpanther.kmscert.dto.SigningEngineSettings;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses how the remote key is presented to the certificate toolkit
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SigningHandleFactory {

    private final AWSKMSService kmsService;
    private final PKCS11Service pkcs11Service;

    public SigningHandle open(String keyId, SigningAlgorithm algorithm, SigningEngineSettings settings) {
        if (settings.usesPkcs11()) {
            return pkcs11Service.openSigningHandle(settings, algorithm);
        }
        log.debug("Signing through the KMS Sign API with key {}", keyId);
        return new SigningHandle(new KmsContentSigner(kmsService, keyId, algorithm));
    }
}
