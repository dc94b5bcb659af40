package com.wpanther.kmscert.exception;

public abstract class KeySpecException extends KmsCertException {

    protected KeySpecException(String message) {
        super(message);
    }

    protected KeySpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
