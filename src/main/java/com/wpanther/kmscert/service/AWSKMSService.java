package com.wpanther.kmscert.service;

import org.springframework.stereotype.Service;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.dto.KeyDescriptor;
import com.wpanther.kmscert.dto.SigningAlgorithm;
import com.wpanther.kmscert.exception.OracleCallException;
import com.wpanther.kmscert.exception.SigningException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.model.DescribeKeyRequest;
import software.amazon.awssdk.services.kms.model.DescribeKeyResponse;
import software.amazon.awssdk.services.kms.model.GetPublicKeyRequest;
import software.amazon.awssdk.services.kms.model.GetPublicKeyResponse;
import software.amazon.awssdk.services.kms.model.KeyMetadata;
import software.amazon.awssdk.services.kms.model.MessageType;
import software.amazon.awssdk.services.kms.model.SignRequest;
import software.amazon.awssdk.services.kms.model.SignResponse;

/**
 * Service for interacting with AWS KMS, the signing oracle that holds the private key
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AWSKMSService {

    private final AwsClientFactory clientFactory;

    /**
     * Gets the cryptographic parameters of a key
     *
     * @param keyId The KMS key ID, alias or ARN
     * @return Key descriptor
     */
    public KeyDescriptor describeKey(String keyId) {
        try {
            DescribeKeyRequest request = DescribeKeyRequest.builder()
                .keyId(keyId)
                .build();

            DescribeKeyResponse response = clientFactory.kms(keyId).describeKey(request);
            KeyMetadata metadata = response.keyMetadata();

            log.debug("Key {} has spec {} and usage {}", keyId, metadata.keySpec(), metadata.keyUsage());

            return KeyDescriptor.builder()
                .keyId(keyId)
                .keyArn(metadata.arn())
                .keySpec(metadata.keySpec())
                .keyUsage(metadata.keyUsage())
                .enabled(Boolean.TRUE.equals(metadata.enabled()))
                .build();

        } catch (SdkException e) {
            log.error("Failed to describe key in AWS KMS", e);
            throw new OracleCallException("Failed to describe key " + keyId + " in AWS KMS: " + e.getMessage(), e);
        }
    }

    /**
     * Gets the public key for a KMS key
     *
     * @param keyId The KMS key ID, alias or ARN
     * @return DER-encoded SubjectPublicKeyInfo
     */
    public byte[] getPublicKey(String keyId) {
        try {
            GetPublicKeyRequest request = GetPublicKeyRequest.builder()
                .keyId(keyId)
                .build();

            GetPublicKeyResponse response = clientFactory.kms(keyId).getPublicKey(request);
            return response.publicKey().asByteArray();

        } catch (SdkException e) {
            log.error("Failed to get public key from AWS KMS", e);
            throw new OracleCallException("Failed to get public key of " + keyId + " from AWS KMS: " + e.getMessage(), e);
        }
    }

    /**
     * Signs a digest using AWS KMS
     *
     * @param keyId The KMS key ID, alias or ARN
     * @param digest The digest bytes to sign
     * @param algorithm The signing algorithm; the digest must match its digest algorithm
     * @return The signature bytes (DER-encoded for ECDSA)
     */
    public byte[] signDigest(String keyId, byte[] digest, SigningAlgorithm algorithm) {
        try {
            SignRequest signRequest = SignRequest.builder()
                .keyId(keyId)
                .message(SdkBytes.fromByteArray(digest))
                .messageType(MessageType.DIGEST)  // KMS must not hash the digest again
                .signingAlgorithm(algorithm.getKmsAlgorithm())
                .build();

            SignResponse signResponse = clientFactory.kms(keyId).sign(signRequest);

            return signResponse.signature().asByteArray();

        } catch (SdkException e) {
            log.error("Failed to sign with AWS KMS", e);
            throw new SigningException("Failed to sign with AWS KMS: " + e.getMessage(), e);
        }
    }
}
