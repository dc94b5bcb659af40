package com.wpanther.kmscert.exception;

/**
 * Writing the finished certificate to its destination failed.
 * The certificate itself was produced successfully.
 */
public class SinkWriteException extends KmsCertException {

    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
