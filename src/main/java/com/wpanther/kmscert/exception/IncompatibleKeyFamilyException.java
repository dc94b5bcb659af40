package com.wpanther.kmscert.exception;

/**
 * The key family was rejected by the RSA-only compatibility check.
 */
public class IncompatibleKeyFamilyException extends KeySpecException {

    public IncompatibleKeyFamilyException(String message) {
        super(message);
    }

    public IncompatibleKeyFamilyException(String message, Throwable cause) {
        super(message, cause);
    }
}
