package com.forgebot.worker.retry;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Creates {@link RetryController}s with the configured limit and backoff base. */
@Component
public class RetryControllerFactory {

    private final int  retryLimit;
    private final long baseDelaySeconds;

    public RetryControllerFactory(
            @Value("${forgebot.retry.limit:2}") int retryLimit,
            @Value("${forgebot.retry.base-delay-seconds:120}") long baseDelaySeconds) {
        this.retryLimit       = retryLimit;
        this.baseDelaySeconds = baseDelaySeconds;
    }

    public RetryController create(TaskContext context) {
        return new RetryController(context, retryLimit, baseDelaySeconds);
    }

    public int retryLimit() {
        return retryLimit;
    }
}
