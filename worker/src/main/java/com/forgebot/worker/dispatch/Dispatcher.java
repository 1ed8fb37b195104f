package com.forgebot.worker.dispatch;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.handler.HandlerMatch;
import com.forgebot.worker.handler.HandlerRegistry;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.jobs.PackageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for normalized events.
 *
 * Classifies the event, then turns every (handler, job) pair into an
 * independent {@link HandlerInvocation}. Siblings of one event run in no
 * particular order; prerequisite selection is the registry's job, not a
 * blocking gate here.
 */
@Service
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final HandlerRegistry registry;
    private final TaskExecutor    executor;
    private final HandlerRunner   runner;

    public Dispatcher(HandlerRegistry registry, TaskExecutor executor, HandlerRunner runner) {
        this.registry = registry;
        this.executor = executor;
        this.runner   = runner;
    }

    /**
     * Schedule one invocation per matching (handler, job) pair.
     *
     * @return the scheduled invocations, in classification order
     */
    public List<HandlerInvocation> dispatch(Event event, PackageConfig packageConfig) {
        List<HandlerInvocation> invocations = invocationsFor(event, packageConfig);
        if (invocations.isEmpty()) {
            log.info("No handler matched {} event for {}", event.kind(), packageConfig.packageName());
        }
        invocations.forEach(executor::submit);
        return invocations;
    }

    /**
     * Run every matching invocation on the calling thread and collect the
     * results. Used to replay completion events; retries requested from here
     * still go through the {@link TaskExecutor}.
     */
    public List<TaskResult> dispatchInline(Event event, PackageConfig packageConfig) {
        List<TaskResult> results = new ArrayList<>();
        for (HandlerInvocation invocation : invocationsFor(event, packageConfig)) {
            results.add(runner.run(invocation, new QueuedTaskContext(invocation, 0, executor)));
        }
        return results;
    }

    private List<HandlerInvocation> invocationsFor(Event event, PackageConfig packageConfig) {
        List<HandlerMatch> matches = registry.handlersFor(event, packageConfig);
        List<HandlerInvocation> invocations = new ArrayList<>(matches.size());
        for (HandlerMatch match : matches) {
            log.debug("Dispatching {} for {} job", match.handlerName(), match.jobConfig().type());
            invocations.add(new HandlerInvocation(match.handlerName(), packageConfig,
                    match.jobConfig(), event, Map.of()));
        }
        return invocations;
    }
}
