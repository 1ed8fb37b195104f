package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.JobOutcome;
import com.forgebot.worker.external.CommitState;
import com.forgebot.worker.external.StatusReporter;
import com.forgebot.worker.handler.CheckNames;
import com.forgebot.worker.handler.HandlerContext;
import com.forgebot.worker.handler.JobHandler;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.service.RunService;
import com.forgebot.worker.service.TargetStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared completion path for tracked Targets.
 *
 * Live callbacks and the reconciliation loop both end up here, so a
 * completed external job is handled the same way whoever noticed it first.
 * A Target that is already terminal is left alone.
 */
abstract class CompletionHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    private final TargetKind         kind;
    private final String             checkPrefix;
    protected final RunService         runService;
    protected final TargetStateMachine stateMachine;
    protected final StatusReporter     reporter;

    protected CompletionHandler(TargetKind kind, String checkPrefix, RunService runService,
                                TargetStateMachine stateMachine, StatusReporter reporter) {
        this.kind         = kind;
        this.checkPrefix  = checkPrefix;
        this.runService   = runService;
        this.stateMachine = stateMachine;
        this.reporter     = reporter;
    }

    @Override
    public TaskResult run(HandlerContext ctx) {
        Event event = ctx.event();
        List<Target> targets = ResultTargets.matching(runService, kind, event);
        if (targets.isEmpty()) {
            log.warn("No {} target known for {} {}", kind, event.correlationId(), event.targetKey());
            return TaskResult.skipped("No target for " + event.correlationId());
        }

        JobOutcome outcome = event.outcome() != null ? event.outcome() : JobOutcome.ERROR;
        Map<UUID, Run> touched = new LinkedHashMap<>();
        int completed = 0;
        for (Target target : targets) {
            if (target.isTerminal()) {
                log.debug("Target {} already {}, ignoring result", target.getId(), target.getStatus());
                continue;
            }
            if (!stateMachine.complete(target, outcome)) {
                continue;
            }
            completed++;
            touched.put(target.getRun().getId(), target.getRun());
            String url = event.resultUrl() != null ? event.resultUrl() : runService.resultUrl(target);
            reporter.report(target.getRun().getRepoUrl(), target.getRun().getCommitSha(),
                    CheckNames.of(checkPrefix, target.getTargetKey(), ctx.jobConfig().identifier()),
                    outcome == JobOutcome.SUCCESS ? CommitState.SUCCESS : CommitState.FAILURE,
                    description(outcome), url);
        }
        touched.values().forEach(stateMachine::aggregate);
        return TaskResult.ok(completed + " target(s) of " + event.correlationId() + " completed: " + outcome);
    }

    protected abstract String description(JobOutcome outcome);
}
