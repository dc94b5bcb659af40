package com.wpanther.kmscert.exception;

/**
 * Base type for every failure the certificate tool reports to its caller.
 * All subclasses are fatal for the current invocation; nothing is retried.
 */
public abstract class KmsCertException extends RuntimeException {

    protected KmsCertException(String message) {
        super(message);
    }

    protected KmsCertException(String message, Throwable cause) {
        super(message, cause);
    }
}
