package com.forgebot.worker.dispatch;

import com.forgebot.worker.handler.HandlerContext;
import com.forgebot.worker.handler.HandlerRegistry;
import com.forgebot.worker.handler.JobHandler;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.retry.RetriesExhaustedException;
import com.forgebot.worker.retry.RetryController;
import com.forgebot.worker.retry.RetryControllerFactory;
import com.forgebot.worker.retry.TaskContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Runs one handler invocation: pre-check gate, then the handler under a
 * {@link RetryController}.
 *
 * Errors that escape the handler are unclassified. They are retried with
 * the default backoff while attempts remain; on the last try they are
 * logged and reported as a failed result.
 *
 * Every run is timed and counted:
 * <pre>
 *   forgebot.handler.runs{handler, status="success|failure|skipped|retrying|error"}
 *   forgebot.handler.duration{handler}
 * </pre>
 */
@Component
public class HandlerRunner {

    private static final Logger log = LoggerFactory.getLogger(HandlerRunner.class);

    private final HandlerRegistry        registry;
    private final RetryControllerFactory retryFactory;
    private final MeterRegistry          meterRegistry;

    public HandlerRunner(HandlerRegistry registry,
                         RetryControllerFactory retryFactory,
                         MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.retryFactory  = retryFactory;
        this.meterRegistry = meterRegistry;
    }

    public TaskResult run(HandlerInvocation invocation, TaskContext taskContext) {
        JobHandler      handler = registry.get(invocation.handlerName());
        RetryController retry   = retryFactory.create(taskContext);
        HandlerContext  ctx     = new HandlerContext(invocation.packageConfig(),
                invocation.jobConfig(), invocation.event(), retry, taskContext.state());

        MDC.put("handler", invocation.handlerName());
        MDC.put("jobType", invocation.jobConfig().type().name());
        MDC.put("attempt", String.valueOf(taskContext.attempt()));

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            if (!handler.preCheck(ctx)) {
                log.info("Pre-check of {} did not pass, skipping", invocation.handlerName());
                status = "skipped";
                return TaskResult.skipped("pre-check did not pass");
            }
            TaskResult result = handler.run(ctx);
            status = result.outcome().name().toLowerCase();
            return result;
        } catch (RetriesExhaustedException e) {
            log.error("Handler {} gave up after {} attempt(s)", invocation.handlerName(),
                    e.getAttempts(), e.getCause());
            return TaskResult.failure(e.getMessage());
        } catch (Exception e) {
            if (retry.isRetryScheduled()) {
                log.warn("Handler {} failed after scheduling a retry: {}",
                        invocation.handlerName(), e.getMessage());
                status = "retrying";
                return TaskResult.retrying(e.getMessage());
            }
            if (!retry.isLastTry()) {
                log.warn("Handler {} failed, retrying: {}", invocation.handlerName(), e.getMessage());
                retry.retry(e);
                status = "retrying";
                return TaskResult.retrying(e.getMessage());
            }
            log.error("Handler {} failed on the last try: {}",
                    invocation.handlerName(), e.getMessage(), e);
            return TaskResult.failure(e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("forgebot.handler.duration",
                    "handler", invocation.handlerName()));
            meterRegistry.counter("forgebot.handler.runs",
                    "handler", invocation.handlerName(), "status", status).increment();
            MDC.remove("handler");
            MDC.remove("jobType");
            MDC.remove("attempt");
        }
    }
}
