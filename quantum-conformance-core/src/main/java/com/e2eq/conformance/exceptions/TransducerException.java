package com.e2eq.conformance.exceptions;

/**
 * Failure of the external text transducer: the call raised, returned unusable output, or did
 * not answer within the per-attempt timeout.
 */
public class TransducerException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final boolean timeout;
    private final int statusCode;

    public TransducerException(String message) {
        this(message, null, false, -1);
    }

    public TransducerException(String message, Throwable cause) {
        this(message, cause, false, -1);
    }

    public TransducerException(String message, int statusCode) {
        this(message, null, false, statusCode);
    }

    private TransducerException(String message, Throwable cause, boolean timeout, int statusCode) {
        super(message, cause);
        this.timeout = timeout;
        this.statusCode = statusCode;
    }

    public static TransducerException timedOut(String message, Throwable cause) {
        return new TransducerException(message, cause, true, -1);
    }

    public boolean isTimeout() {
        return timeout;
    }

    /**
     * HTTP status of the failed call, or -1 when the failure was not an HTTP response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
