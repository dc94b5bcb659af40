package com.wpanther.kmscert.exception;

/**
 * The output destination string does not match any supported destination grammar.
 */
public class InvalidDestinationException extends InputValidationException {

    public InvalidDestinationException(String message) {
        super(message);
    }

    public InvalidDestinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
