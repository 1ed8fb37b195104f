package com.forgebot.worker.external;

/**
 * The operation executor rejected the request. Permanent: retrying will
 * not help, the Target ends in ERROR.
 */
public class OperationException extends RuntimeException {

    public OperationException(String message) {
        super(message);
    }

    public OperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
