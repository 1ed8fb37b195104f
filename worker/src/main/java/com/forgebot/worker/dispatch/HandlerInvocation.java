package com.forgebot.worker.dispatch;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.PackageConfig;

import java.util.Map;

/**
 * Message handed to the execution environment: everything needed to run
 * one handler for one job, plus state carried over from earlier attempts.
 */
public record HandlerInvocation(
        String              handlerName,
        PackageConfig       packageConfig,
        JobConfig           jobConfig,
        Event               event,
        Map<String, Object> state) {

    public HandlerInvocation {
        state = state == null ? Map.of() : Map.copyOf(state);
    }

    public HandlerInvocation withState(Map<String, Object> newState) {
        return new HandlerInvocation(handlerName, packageConfig, jobConfig, event, newState);
    }
}
