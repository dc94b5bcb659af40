package com.wpanther.kmscert.exception;

/**
 * The certificate toolkit could not assemble or encode the certificate.
 */
public class CertificateGenerationException extends KmsCertException {

    public CertificateGenerationException(String message) {
        super(message);
    }

    public CertificateGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
