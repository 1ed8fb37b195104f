package com.forgebot.worker.dispatch;

import com.forgebot.worker.retry.TaskContext;

import java.time.Duration;
import java.util.Map;

/** {@link TaskContext} backed by a {@link TaskExecutor}: rescheduling re-queues the invocation. */
public class QueuedTaskContext implements TaskContext {

    private final HandlerInvocation invocation;
    private final int               attempt;
    private final TaskExecutor      executor;

    public QueuedTaskContext(HandlerInvocation invocation, int attempt, TaskExecutor executor) {
        this.invocation = invocation;
        this.attempt    = attempt;
        this.executor   = executor;
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public Map<String, Object> state() {
        return invocation.state();
    }

    @Override
    public void reschedule(Duration countdown, Map<String, Object> state) {
        executor.schedule(invocation.withState(state), attempt + 1, countdown);
    }
}
