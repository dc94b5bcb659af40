package com.wpanther.kmscert.exception;

public class WrongKeyUsageException extends KeySpecException {

    public WrongKeyUsageException(String message) {
        super(message);
    }

    public WrongKeyUsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
