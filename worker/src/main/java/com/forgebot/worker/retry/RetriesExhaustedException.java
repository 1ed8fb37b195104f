package com.forgebot.worker.retry;

/**
 * Thrown when a retry is requested on the last try. The original failure is
 * the cause and must be treated as terminal.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable cause) {
        super("Retries exhausted after " + attempts + " attempt(s): "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.attempts = attempts;
    }

    public int getAttempts() { return attempts; }
}
