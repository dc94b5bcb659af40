package com.wpanther.kmscert.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.springframework.stereotype.Service;

import com.wpanther.kmscert.dto.VerificationResult;
import com.wpanther.kmscert.exception.InputFileException;
import com.wpanther.kmscert.exception.OracleCallException;
import com.wpanther.kmscert.util.PemUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks that a certificate carries the public key of a KMS key or of a local key file
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KeyVerificationService {

    private final AWSKMSService kmsService;
    private final KeyMatcher keyMatcher;
    private final PemUtil pemUtil;

    public VerificationResult verifyAgainstKmsKey(Path certificateFile, String keyId) {
        String certificateKey = certificatePublicKey(certificateFile);

        SubjectPublicKeyInfo kmsKey;
        try {
            kmsKey = SubjectPublicKeyInfo.getInstance(kmsService.getPublicKey(keyId));
        } catch (IllegalArgumentException e) {
            throw new OracleCallException("KMS returned an unreadable public key for " + keyId, e);
        }

        return compare(certificateKey, keyMatcher.toCanonicalPem(kmsKey), keyId);
    }

    public VerificationResult verifyAgainstKeyFile(Path certificateFile, Path keyFile) {
        String certificateKey = certificatePublicKey(certificateFile);

        SubjectPublicKeyInfo fileKey;
        try {
            fileKey = pemUtil.readPublicKeyInfo(readFile(keyFile, "Key"));
        } catch (IOException e) {
            throw new InputFileException("Invalid key file " + keyFile + ": " + e.getMessage(), e);
        }

        return compare(certificateKey, keyMatcher.toCanonicalPem(fileKey), keyFile.toString());
    }

    private VerificationResult compare(String certificateKey, String referenceKey, String reference) {
        boolean match = keyMatcher.equal(certificateKey, referenceKey);
        if (match) {
            log.info("Certificate public key matches {}", reference);
        } else {
            log.warn("Certificate public key does not match {}", reference);
        }
        return VerificationResult.builder()
            .match(match)
            .certificatePublicKeyPem(certificateKey)
            .referencePublicKeyPem(referenceKey)
            .reference(reference)
            .build();
    }

    private String certificatePublicKey(Path certificateFile) {
        try {
            SubjectPublicKeyInfo publicKey = pemUtil.readCertificate(readFile(certificateFile, "Certificate"))
                .getSubjectPublicKeyInfo();
            return keyMatcher.toCanonicalPem(publicKey);
        } catch (IOException e) {
            throw new InputFileException("Invalid certificate file " + certificateFile + ": " + e.getMessage(), e);
        }
    }

    private byte[] readFile(Path file, String description) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new InputFileException(description + " file not found: " + file);
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new InputFileException("Could not read " + description.toLowerCase() + " file " + file
                + ": " + e.getMessage(), e);
        }
    }
}
