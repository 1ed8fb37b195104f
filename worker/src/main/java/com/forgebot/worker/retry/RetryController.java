package com.forgebot.worker.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Bounded, exponentially backed-off retries for one handler invocation.
 *
 * The attempt count is owned by the execution environment and read through
 * the {@link TaskContext}; this class only decides whether another attempt is
 * allowed and when it should happen. Default delay is
 * {@code baseDelay * 2^attempt}: 120s, 240s, 480s, ...
 *
 * One instance per invocation; not thread-safe.
 */
public class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final TaskContext context;
    private final int         retryLimit;
    private final long        baseDelaySeconds;

    private boolean retryScheduled;

    public RetryController(TaskContext context, int retryLimit, long baseDelaySeconds) {
        if (retryLimit < 0) throw new IllegalArgumentException("retryLimit must be >= 0");
        if (baseDelaySeconds <= 0) throw new IllegalArgumentException("baseDelaySeconds must be > 0");
        this.context          = context;
        this.retryLimit       = retryLimit;
        this.baseDelaySeconds = baseDelaySeconds;
    }

    public int retries()    { return context.attempt(); }
    public int retryLimit() { return retryLimit; }

    public boolean isLastTry() {
        return context.attempt() >= retryLimit;
    }

    /** True once this invocation has asked for another attempt. */
    public boolean isRetryScheduled() {
        return retryScheduled;
    }

    public Duration delayFor(int attempt) {
        return Duration.ofSeconds(baseDelaySeconds * (1L << Math.min(attempt, 30)));
    }

    public void retry(Throwable error) {
        retry(error, null, null, Map.of());
    }

    public void retry(Throwable error, Map<String, Object> injected) {
        retry(error, null, null, injected);
    }

    /**
     * Ask the environment for another attempt.
     *
     * Returns immediately. The state of the current attempt is carried over,
     * with {@code injected} entries added on top (e.g. the id of a Run created
     * by this attempt). A second call within the same attempt is ignored.
     *
     * @param delay      explicit countdown, or null for the exponential default
     * @param maxRetries overrides the configured limit for this call, or null
     * @throws RetriesExhaustedException if no attempt is left
     */
    public void retry(Throwable error, Duration delay, Integer maxRetries,
                      Map<String, Object> injected) {
        int attempt = context.attempt();
        int limit   = maxRetries != null ? maxRetries : retryLimit;
        if (attempt >= limit) {
            throw new RetriesExhaustedException(attempt + 1, error);
        }
        if (retryScheduled) {
            log.debug("Retry already scheduled for this attempt, ignoring: {}",
                    error == null ? null : error.getMessage());
            return;
        }

        Duration countdown = delay != null ? delay : delayFor(attempt);
        Map<String, Object> state = new HashMap<>(context.state());
        if (injected != null) {
            state.putAll(injected);
        }

        log.info("Will retry for the {}. time in {}s: {}", attempt + 1, countdown.toSeconds(),
                error == null ? "no cause" : error.getMessage());
        context.reschedule(countdown, state);
        retryScheduled = true;
    }
}
