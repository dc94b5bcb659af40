package com.wpanther.kmscert.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.util.Arrays;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;
import org.springframework.stereotype.Component;

import com.wpanther.kmscert.exception.UnsupportedPublicKeyFormatException;
import com.wpanther.kmscert.util.PemUtil;

import lombok.RequiredArgsConstructor;

/**
 * Compares public keys as PEM text.
 *
 * <p>The comparison is byte-exact after line endings and the trailing newline
 * are normalised; no ASN.1 comparison is done. Keys that went through
 * different PEM writers may wrap differently, so callers that hold key objects
 * should compare the output of {@link #toCanonicalPem} rather than raw file text.
 */
@Component
@RequiredArgsConstructor
public class KeyMatcher {

    private final PemUtil pemUtil;

    public boolean equal(String pemA, String pemB) {
        requireSupported(pemA);
        requireSupported(pemB);
        byte[] a = canonicalize(pemA).getBytes(StandardCharsets.UTF_8);
        byte[] b = canonicalize(pemB).getBytes(StandardCharsets.UTF_8);
        return Arrays.equals(a, b);
    }

    /**
     * Re-encodes a public key through the PEM writer so that equal keys produce equal text
     */
    public String toCanonicalPem(SubjectPublicKeyInfo publicKeyInfo) {
        requireSupported(publicKeyInfo);
        try {
            return canonicalize(pemUtil.toPem(publicKeyInfo));
        } catch (IOException e) {
            throw new UnsupportedPublicKeyFormatException("Failed to encode public key: " + e.getMessage(), e);
        }
    }

    public String toCanonicalPem(PublicKey publicKey) {
        return toCanonicalPem(SubjectPublicKeyInfo.getInstance(publicKey.getEncoded()));
    }

    static String canonicalize(String pem) {
        return pem.replace("\r\n", "\n").replace('\r', '\n').strip() + "\n";
    }

    private void requireSupported(String pem) {
        if (pem == null) {
            throw new UnsupportedPublicKeyFormatException("No public key given");
        }
        try {
            requireSupported(pemUtil.readPublicKeyPem(pem));
        } catch (IOException e) {
            throw new UnsupportedPublicKeyFormatException("Not a PEM public key: " + e.getMessage(), e);
        }
    }

    private void requireSupported(SubjectPublicKeyInfo publicKeyInfo) {
        ASN1ObjectIdentifier algorithm = publicKeyInfo.getAlgorithm().getAlgorithm();
        if (!PKCSObjectIdentifiers.rsaEncryption.equals(algorithm)
                && !X9ObjectIdentifiers.id_ecPublicKey.equals(algorithm)) {
            throw new UnsupportedPublicKeyFormatException(
                "Only RSA and EC public keys are supported, got algorithm " + algorithm);
        }
    }
}
