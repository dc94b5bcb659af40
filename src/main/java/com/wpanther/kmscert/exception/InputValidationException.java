package com.wpanther.kmscert.exception;

/**
 * Missing or malformed caller input, reported before any KMS call is made.
 */
public class InputValidationException extends KmsCertException {

    public InputValidationException(String message) {
        super(message);
    }

    public InputValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
