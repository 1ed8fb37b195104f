package com.forgebot.worker.handler;

/** What one handler invocation reports back to the dispatcher. */
public record TaskResult(Outcome outcome, String details) {

    public enum Outcome { SUCCESS, FAILURE, SKIPPED, RETRYING }

    public static TaskResult ok(String details)      { return new TaskResult(Outcome.SUCCESS, details); }
    public static TaskResult failure(String details) { return new TaskResult(Outcome.FAILURE, details); }
    public static TaskResult skipped(String details) { return new TaskResult(Outcome.SKIPPED, details); }

    /** Another attempt has been scheduled; the outcome is not known yet. */
    public static TaskResult retrying(String details) { return new TaskResult(Outcome.RETRYING, details); }

    /** Skipped invocations are not failures. */
    public boolean success() {
        return outcome == Outcome.SUCCESS || outcome == Outcome.SKIPPED;
    }
}
