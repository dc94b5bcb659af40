package com.wpanther.kmscert.service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.springframework.stereotype.Component;

import com.wpanther.kmscert.dto.CertificateRequest;
import com.wpanther.kmscert.exception.CertificateGenerationException;
import com.wpanther.kmscert.exception.KmsCertException;
import com.wpanther.kmscert.exception.SigningException;
import com.wpanther.kmscert.util.PemUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a self-signed X.509 v3 certificate for a public key whose private
 * half is only reachable through a signing handle
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SelfSignedCertificateBuilder {

    private final Clock clock;
    private final PemUtil pemUtil;

    /**
     * Builds and signs the certificate
     *
     * @param request Subject, extensions and validity
     * @param publicKeyDer DER-encoded SubjectPublicKeyInfo of the signing key
     * @param signer Handle that signs with the matching private key
     * @return The certificate as PEM text
     */
    public String build(CertificateRequest request, byte[] publicKeyDer, ContentSigner signer) {
        try {
            SubjectPublicKeyInfo publicKeyInfo = SubjectPublicKeyInfo.getInstance(publicKeyDer);
            X500Name subject = buildSubject(request);

            Instant notBefore = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            Instant notAfter = notBefore.plus(Duration.ofDays(request.getValidityDays()));

            X509v3CertificateBuilder builder = new X509v3CertificateBuilder(
                subject,
                BigInteger.valueOf(request.getSerial()),
                Date.from(notBefore),
                Date.from(notAfter),
                subject,
                publicKeyInfo);

            builder.addExtension(Extension.basicConstraints, true,
                new BasicConstraints(request.isCertificateAuthority()));
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                new JcaX509ExtensionUtils().createSubjectKeyIdentifier(publicKeyInfo));

            List<String> sans = request.getSubjectAlternativeNames();
            if (!sans.isEmpty()) {
                GeneralName[] names = sans.stream()
                    .map(name -> new GeneralName(GeneralName.dNSName, name))
                    .toArray(GeneralName[]::new);
                builder.addExtension(Extension.subjectAlternativeName, false, new GeneralNames(names));
            }

            X509CertificateHolder certificate = builder.build(signer);
            // A PKCS#11 label may name a different key than the KMS key ID
            if (!certificate.isSignatureValid(new JcaContentVerifierProviderBuilder().build(publicKeyInfo))) {
                throw new SigningException(
                    "Certificate signature does not verify with the public key of the KMS key");
            }
            log.info("Issued certificate for '{}' with serial {}, valid until {}",
                subject, request.getSerial(), notAfter);

            return pemUtil.toPem(certificate);

        } catch (KmsCertException e) {
            // Signing failures keep their own type
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate certificate", e);
            throw new CertificateGenerationException("Failed to generate certificate: " + e.getMessage(), e);
        }
    }

    /**
     * Subject in the order C, ST, L, O, OU, CN, emailAddress. Certificates issued
     * earlier use this order, so it must not change.
     */
    X500Name buildSubject(CertificateRequest request) {
        X500NameBuilder builder = new X500NameBuilder(BCStyle.INSTANCE);
        addIfPresent(builder, BCStyle.C, request.getCountry());
        addIfPresent(builder, BCStyle.ST, request.getState());
        addIfPresent(builder, BCStyle.L, request.getLocality());
        addIfPresent(builder, BCStyle.O, request.getOrganization());
        addIfPresent(builder, BCStyle.OU, request.getOrganizationalUnit());
        builder.addRDN(BCStyle.CN, request.getCommonName());
        addIfPresent(builder, BCStyle.EmailAddress, request.getEmailAddress());
        return builder.build();
    }

    private void addIfPresent(X500NameBuilder builder, ASN1ObjectIdentifier type, String value) {
        if (value != null && !value.isBlank()) {
            builder.addRDN(type, value);
        }
    }
}
