package com.wpanther.kmscert.exception;

/**
 * An input file (certificate or key) is missing, unreadable or cannot be parsed.
 */
public class InputFileException extends InputValidationException {

    public InputFileException(String message) {
        super(message);
    }

    public InputFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
