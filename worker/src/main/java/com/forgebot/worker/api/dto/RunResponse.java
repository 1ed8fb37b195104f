package com.forgebot.worker.api.dto;

import com.forgebot.worker.jobs.JobTrigger;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.RunStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /runs/{id}.
 */
public record RunResponse(
        UUID       id,
        String     handler,
        JobType    jobType,
        JobTrigger trigger,
        String     repoUrl,
        String     commitSha,
        RunStatus  status,
        Instant    createdAt,
        Instant    finishedAt
) {
    public static RunResponse from(Run run) {
        return new RunResponse(
                run.getId(),
                run.getHandlerName(),
                run.getJobType(),
                run.getTrigger(),
                run.getRepoUrl(),
                run.getCommitSha(),
                run.getStatus(),
                run.getCreatedAt(),
                run.getFinishedAt()
        );
    }
}
