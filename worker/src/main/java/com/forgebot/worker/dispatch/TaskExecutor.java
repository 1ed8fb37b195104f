package com.forgebot.worker.dispatch;

import java.time.Duration;

/**
 * Execution environment for handler invocations.
 *
 * Submissions return immediately; the invocation runs later on some worker.
 */
public interface TaskExecutor {

    /** Run a fresh invocation (attempt 0) as soon as a worker is free. */
    void submit(HandlerInvocation invocation);

    /** Run {@code invocation} as retry number {@code attempt} after {@code countdown}. */
    void schedule(HandlerInvocation invocation, int attempt, Duration countdown);
}
