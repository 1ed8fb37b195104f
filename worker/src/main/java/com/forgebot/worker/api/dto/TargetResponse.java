package com.forgebot.worker.api.dto;

import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.model.TargetStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a Target, returned by GET /runs/{id}/targets and
 * GET /runs/targets/{id}. Logs are only included in the single-target view.
 */
public record TargetResponse(
        UUID         id,
        TargetKind   kind,
        String       key,
        TargetStatus status,
        String       correlationId,
        String       resultUrl,
        String       errorMessage,
        Instant      createdAt,
        Instant      submittedAt,
        Instant      startedAt,
        Instant      finishedAt,
        String       logs
) {
    public static TargetResponse from(Target t) {
        return from(t, false);
    }

    public static TargetResponse from(Target t, boolean withLogs) {
        return new TargetResponse(
                t.getId(),
                t.getKind(),
                t.getTargetKey(),
                t.getStatus(),
                t.getCorrelationId(),
                t.getResultUrl(),
                t.getErrorMessage(),
                t.getCreatedAt(),
                t.getSubmittedAt(),
                t.getStartedAt(),
                t.getFinishedAt(),
                withLogs ? t.getLogs() : null
        );
    }
}
