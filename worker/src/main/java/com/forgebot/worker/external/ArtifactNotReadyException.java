package com.forgebot.worker.external;

/**
 * An upstream artifact (release tarball, SRPM) is not published yet.
 * Transient: the Target goes to RETRY and the invocation is retried later.
 */
public class ArtifactNotReadyException extends RuntimeException {

    public ArtifactNotReadyException(String message) {
        super(message);
    }
}
