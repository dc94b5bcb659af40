package com.wpanther.kmscert.service;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.dto.KeyDescriptor;
import com.wpanther.kmscert.dto.SigningAlgorithm;
import com.wpanther.kmscert.exception.IncompatibleKeyFamilyException;
import com.wpanther.kmscert.exception.UnsupportedKeySpecException;
import com.wpanther.kmscert.exception.WrongKeyUsageException;

import software.amazon.awssdk.services.kms.model.KeyUsageType;

/**
 * Maps a KMS key spec to the algorithm its certificate is signed with.
 * Both checks run before any signing call.
 */
@Component
public class KeySpecResolver {

    public SigningAlgorithm resolve(KeyDescriptor descriptor) {
        SigningAlgorithm algorithm = algorithmFor(descriptor);

        if (descriptor.getKeyUsage() != KeyUsageType.SIGN_VERIFY) {
            throw new WrongKeyUsageException("Key " + descriptor.getKeyId() + " has usage "
                + descriptor.getKeyUsage() + "; a SIGN_VERIFY key is required");
        }
        return algorithm;
    }

    /**
     * Pre-flight check for consumers that only accept RSA certificates
     */
    public void checkCompatibility(KeyDescriptor descriptor, boolean requireRsa) {
        if (requireRsa && !descriptor.isRsa()) {
            throw new IncompatibleKeyFamilyException("Key " + descriptor.getKeyId() + " has spec "
                + descriptor.getKeySpec() + " but an RSA key is required");
        }
    }

    private SigningAlgorithm algorithmFor(KeyDescriptor descriptor) {
        if (descriptor.getKeySpec() == null) {
            throw new UnsupportedKeySpecException("Key " + descriptor.getKeyId() + " reports no key spec");
        }
        switch (descriptor.getKeySpec()) {
            case RSA_2048:
            case RSA_3072:
            case RSA_4096:
                return SigningAlgorithm.RSA_PKCS1_SHA_256;
            case ECC_NIST_P256:
                return SigningAlgorithm.ECDSA_SHA_256;
            case ECC_NIST_P384:
                return SigningAlgorithm.ECDSA_SHA_384;
            case ECC_NIST_P521:
                return SigningAlgorithm.ECDSA_SHA_512;
            default:
                throw new UnsupportedKeySpecException("Unsupported key spec: " + descriptor.getKeySpec());
        }
    }
}
