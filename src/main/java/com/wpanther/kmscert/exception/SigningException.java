package com.wpanther.kmscert.exception;

public class SigningException extends KmsCertException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
