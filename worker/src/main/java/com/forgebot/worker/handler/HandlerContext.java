package com.forgebot.worker.handler;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.PackageConfig;
import com.forgebot.worker.retry.RetryController;

import java.util.Map;
import java.util.UUID;

/**
 * Everything one handler invocation works with.
 *
 * @param state resume state carried forward from a previous attempt (e.g. {@code run_id})
 */
public record HandlerContext(
        PackageConfig       packageConfig,
        JobConfig           jobConfig,
        Event               event,
        RetryController     retry,
        Map<String, Object> state) {

    public static final String RUN_ID = "run_id";

    public HandlerContext {
        state = state == null ? Map.of() : Map.copyOf(state);
    }

    /** Run created by an earlier attempt of this invocation, or null on the first one. */
    public UUID resumeRunId() {
        Object value = state.get(RUN_ID);
        if (value == null) return null;
        return value instanceof UUID uuid ? uuid : UUID.fromString(value.toString());
    }
}
