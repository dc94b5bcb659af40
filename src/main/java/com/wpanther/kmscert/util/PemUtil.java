package com.wpanther.kmscert.util;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import org.bouncycastle.asn1.sec.ECPrivateKey;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * PEM and DER conversions for certificates and keys
 */
@Component
@Slf4j
public class PemUtil {

    private static final String PEM_MARKER = "-----BEGIN ";

    /**
     * Encodes a certificate holder or public key info as PEM text
     */
    public String toPem(Object object) throws IOException {
        StringWriter writer = new StringWriter();
        try (JcaPEMWriter pemWriter = new JcaPEMWriter(writer)) {
            pemWriter.writeObject(object);
        }
        return writer.toString();
    }

    /**
     * Reads a certificate from PEM or DER content
     */
    public X509CertificateHolder readCertificate(byte[] content) throws IOException {
        if (!isPem(content)) {
            try {
                return new X509CertificateHolder(content);
            } catch (RuntimeException e) {
                throw new IOException("Content is neither a PEM nor a DER certificate", e);
            }
        }

        Object object = readPemObject(content);
        if (object instanceof X509CertificateHolder) {
            return (X509CertificateHolder) object;
        }
        throw new IOException("PEM content does not hold a certificate");
    }

    /**
     * Parses PEM text that must hold a public key (PUBLIC KEY or RSA PUBLIC KEY)
     */
    public SubjectPublicKeyInfo readPublicKeyPem(String pem) throws IOException {
        Object object = readPemObject(pem.getBytes(StandardCharsets.UTF_8));
        if (object instanceof SubjectPublicKeyInfo) {
            return (SubjectPublicKeyInfo) object;
        }
        throw new IOException("PEM content does not hold a public key");
    }

    /**
     * Extracts a public key from a key file. Accepts public keys, unencrypted
     * RSA or EC private keys (PKCS#1, SEC1 or PKCS#8), certificates, and DER public keys.
     */
    public SubjectPublicKeyInfo readPublicKeyInfo(byte[] content) throws IOException {
        if (!isPem(content)) {
            try {
                return SubjectPublicKeyInfo.getInstance(content);
            } catch (RuntimeException e) {
                throw new IOException("Content is neither PEM nor a DER public key", e);
            }
        }

        Object object = readPemObject(content);
        if (object instanceof SubjectPublicKeyInfo) {
            return (SubjectPublicKeyInfo) object;
        }
        if (object instanceof X509CertificateHolder) {
            return ((X509CertificateHolder) object).getSubjectPublicKeyInfo();
        }
        if (object instanceof PEMKeyPair) {
            PEMKeyPair keyPair = (PEMKeyPair) object;
            if (keyPair.getPublicKeyInfo() != null) {
                return keyPair.getPublicKeyInfo();
            }
            return publicKeyOf(keyPair.getPrivateKeyInfo());
        }
        if (object instanceof PrivateKeyInfo) {
            return publicKeyOf((PrivateKeyInfo) object);
        }
        throw new IOException("Unsupported PEM object: "
            + (object == null ? "none" : object.getClass().getSimpleName()));
    }

    /**
     * Derives the public half of an RSA or EC private key
     */
    SubjectPublicKeyInfo publicKeyOf(PrivateKeyInfo privateKeyInfo) throws IOException {
        try {
            return derivePublicKey(privateKeyInfo);
        } catch (RuntimeException e) {
            throw new IOException("Malformed private key: " + e.getMessage(), e);
        }
    }

    private SubjectPublicKeyInfo derivePublicKey(PrivateKeyInfo privateKeyInfo) throws IOException {
        AlgorithmIdentifier algorithm = privateKeyInfo.getPrivateKeyAlgorithm();
        ASN1ObjectIdentifier oid = algorithm.getAlgorithm();

        if (PKCSObjectIdentifiers.rsaEncryption.equals(oid)) {
            RSAPrivateKey rsaKey = RSAPrivateKey.getInstance(privateKeyInfo.parsePrivateKey());
            return new SubjectPublicKeyInfo(
                new AlgorithmIdentifier(PKCSObjectIdentifiers.rsaEncryption, DERNull.INSTANCE),
                new RSAPublicKey(rsaKey.getModulus(), rsaKey.getPublicExponent()));
        }

        if (X9ObjectIdentifiers.id_ecPublicKey.equals(oid)) {
            ECPrivateKey ecKey = ECPrivateKey.getInstance(privateKeyInfo.parsePrivateKey());
            if (ecKey.getPublicKey() != null) {
                return new SubjectPublicKeyInfo(algorithm, ecKey.getPublicKey().getBytes());
            }
            if (!(algorithm.getParameters() instanceof ASN1ObjectIdentifier)) {
                throw new IOException("Only named EC curves are supported");
            }
            X9ECParameters curve = ECNamedCurveTable.getByOID((ASN1ObjectIdentifier) algorithm.getParameters());
            if (curve == null) {
                throw new IOException("Unknown EC curve: " + algorithm.getParameters());
            }
            ECPoint q = curve.getG().multiply(ecKey.getKey()).normalize();
            return new SubjectPublicKeyInfo(algorithm, q.getEncoded(false));
        }

        throw new IOException("Cannot derive a public key from a private key of type " + oid);
    }

    private Object readPemObject(byte[] content) throws IOException {
        String text = new String(content, StandardCharsets.UTF_8);
        try (PEMParser parser = new PEMParser(new StringReader(text))) {
            Object object = parser.readObject();
            if (object == null) {
                throw new IOException("No PEM object found");
            }
            log.debug("Read PEM object of type {}", object.getClass().getSimpleName());
            return object;
        } catch (RuntimeException e) {
            // bad base64 or malformed ASN.1 inside the PEM block
            throw new IOException("Malformed PEM content: " + e.getMessage(), e);
        }
    }

    private boolean isPem(byte[] content) {
        return new String(content, StandardCharsets.US_ASCII).contains(PEM_MARKER);
    }
}
