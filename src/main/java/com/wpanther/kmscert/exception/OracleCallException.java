package com.wpanther.kmscert.exception;

/**
 * A KMS describe-key or get-public-key call failed (authorization, throttling, missing key).
 */
public class OracleCallException extends KmsCertException {

    public OracleCallException(String message) {
        super(message);
    }

    public OracleCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
