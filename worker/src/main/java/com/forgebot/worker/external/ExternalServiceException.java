package com.forgebot.worker.external;

/**
 * Thrown when an external service returns an unexpected error or is unreachable.
 */
public class ExternalServiceException extends RuntimeException {

    private final int statusCode;

    public ExternalServiceException(String message) {
        this(message, -1);
    }

    public ExternalServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatusCode() { return statusCode; }
}
