package com.forgebot.worker.api.dto;

import com.forgebot.worker.dispatch.HandlerInvocation;
import com.forgebot.worker.jobs.JobType;

import java.util.List;

/**
 * Response body for POST /events: what got scheduled, in classification order.
 */
public record DispatchResponse(List<Scheduled> scheduled) {

    /**
     * @param synthesized true when the job was added as a prerequisite of a configured one
     */
    public record Scheduled(String handler, JobType jobType, String identifier, boolean synthesized) {}

    public static DispatchResponse from(List<HandlerInvocation> invocations) {
        return new DispatchResponse(invocations.stream()
                .map(i -> new Scheduled(i.handlerName(), i.jobConfig().type(),
                        i.jobConfig().identifier(), i.jobConfig().isSynthesized()))
                .toList());
    }
}
