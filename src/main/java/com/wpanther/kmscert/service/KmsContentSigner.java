package com.wpanther.kmscert.service;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.DefaultSignatureAlgorithmIdentifierFinder;

import com.wpanther.kmscert.dto.SigningAlgorithm;
import com.wpanther.kmscert.exception.SigningException;

import lombok.extern.slf4j.Slf4j;

/**
 * ContentSigner whose private key stays in AWS KMS. The toolkit writes the
 * to-be-signed bytes into this signer; the digest is computed locally and
 * signed by KMS when the signature is requested.
 */
@Slf4j
public class KmsContentSigner implements ContentSigner {

    private final AWSKMSService kmsService;
    private final String keyId;
    private final SigningAlgorithm algorithm;
    private final AlgorithmIdentifier algorithmIdentifier;
    private final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

    public KmsContentSigner(AWSKMSService kmsService, String keyId, SigningAlgorithm algorithm) {
        this.kmsService = kmsService;
        this.keyId = keyId;
        this.algorithm = algorithm;
        this.algorithmIdentifier = new DefaultSignatureAlgorithmIdentifierFinder().find(algorithm.getJcaName());
    }

    @Override
    public AlgorithmIdentifier getAlgorithmIdentifier() {
        return algorithmIdentifier;
    }

    @Override
    public OutputStream getOutputStream() {
        return outputStream;
    }

    @Override
    public byte[] getSignature() {
        byte[] digest;
        try {
            digest = MessageDigest.getInstance(algorithm.getDigestAlgorithm()).digest(outputStream.toByteArray());
        } catch (NoSuchAlgorithmException e) {
            throw new SigningException("Digest algorithm not available: " + algorithm.getDigestAlgorithm(), e);
        }
        log.debug("Requesting {} signature over {} bytes from KMS key {}",
            algorithm.getKmsAlgorithm(), outputStream.size(), keyId);
        return kmsService.signDigest(keyId, digest, algorithm);
    }
}
