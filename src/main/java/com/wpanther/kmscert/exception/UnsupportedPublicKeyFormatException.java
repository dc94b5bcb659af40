package com.wpanther.kmscert.exception;

public class UnsupportedPublicKeyFormatException extends KmsCertException {

    public UnsupportedPublicKeyFormatException(String message) {
        super(message);
    }

    public UnsupportedPublicKeyFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
