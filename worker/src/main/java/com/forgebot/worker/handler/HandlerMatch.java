package com.forgebot.worker.handler;

import com.forgebot.worker.jobs.JobConfig;

/** One (handler, job) pairing selected for an event. */
public record HandlerMatch(HandlerDescriptor descriptor, JobConfig jobConfig) {

    public String handlerName() {
        return descriptor.name();
    }
}
