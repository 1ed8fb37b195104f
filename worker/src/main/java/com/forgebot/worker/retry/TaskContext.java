package com.forgebot.worker.retry;

import java.time.Duration;
import java.util.Map;

/**
 * What the execution environment tells a task about itself, and the one
 * thing the task may ask back: run me again later.
 */
public interface TaskContext {

    /** Number of retries already done for this task; 0 on the first attempt. */
    int attempt();

    /** Key-value state carried over from the previous attempt. */
    Map<String, Object> state();

    /** Schedule another attempt after {@code countdown} with the given state. */
    void reschedule(Duration countdown, Map<String, Object> state);
}
