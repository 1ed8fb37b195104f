package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.service.RunService;

import java.util.List;

/** Finds the Targets a result event reports on. */
final class ResultTargets {

    private ResultTargets() {}

    /** Targets with the event's correlation id, narrowed to its target key when it carries one. */
    static List<Target> matching(RunService runService, TargetKind kind, Event event) {
        if (event.correlationId() == null) {
            return List.of();
        }
        return runService.targetsByCorrelationId(kind, event.correlationId()).stream()
                .filter(t -> event.targetKey() == null || event.targetKey().equals(t.getTargetKey()))
                .toList();
    }
}
