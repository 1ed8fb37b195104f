package com.forgebot.worker.dispatch;

import com.forgebot.worker.handler.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process execution environment.
 *
 * A fixed pool caps how many handlers run at once; countdowns are kept by a
 * single timer thread that hands the invocation to the pool when due.
 * Scheduled retries live in memory only and are lost on shutdown.
 */
@Component
public class LocalTaskExecutor implements TaskExecutor, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LocalTaskExecutor.class);

    private final ExecutorService          workers;
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final HandlerRunner            runner;

    public LocalTaskExecutor(HandlerRunner runner,
                             @Value("${forgebot.worker.threads:4}") int threads) {
        this.runner  = runner;
        this.workers = Executors.newFixedThreadPool(threads);
    }

    @Override
    public void submit(HandlerInvocation invocation) {
        workers.submit(() -> execute(invocation, 0));
    }

    @Override
    public void schedule(HandlerInvocation invocation, int attempt, Duration countdown) {
        log.debug("Scheduling {} attempt {} in {}", invocation.handlerName(), attempt, countdown);
        timer.schedule(() -> workers.submit(() -> execute(invocation, attempt)),
                countdown.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void execute(HandlerInvocation invocation, int attempt) {
        try {
            TaskResult result = runner.run(invocation, new QueuedTaskContext(invocation, attempt, this));
            log.info("Handler {} attempt {} finished: {} {}", invocation.handlerName(), attempt,
                    result.outcome(), result.details());
        } catch (Exception e) {
            log.error("Unhandled error running handler {}: {}",
                    invocation.handlerName(), e.getMessage(), e);
        }
    }

    @Override
    public void destroy() {
        timer.shutdownNow();
        workers.shutdown();
    }
}
