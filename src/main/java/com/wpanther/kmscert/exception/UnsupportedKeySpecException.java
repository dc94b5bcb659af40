package com.wpanther.kmscert.exception;

/**
 * The KMS key spec has no entry in the signing algorithm table.
 */
public class UnsupportedKeySpecException extends KeySpecException {

    public UnsupportedKeySpecException(String message) {
        super(message);
    }

    public UnsupportedKeySpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
