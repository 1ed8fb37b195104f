package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.external.CommitState;
import com.forgebot.worker.external.StatusReporter;
import com.forgebot.worker.handler.CheckNames;
import com.forgebot.worker.handler.HandlerContext;
import com.forgebot.worker.handler.HandlerDescriptor;
import com.forgebot.worker.handler.JobHandler;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.service.RunService;
import org.springframework.stereotype.Component;

import java.util.List;

/** The build farm started a build: tell the forge, status stays SUBMITTED. */
@Component
public class BuildStartHandler implements JobHandler {

    public static final String NAME = "build_start";

    static final HandlerDescriptor DESCRIPTOR = HandlerDescriptor.builder(NAME)
            .configuredAs(JobType.BUILD)
            .requiredFor(JobType.TESTS)
            .reactsTo(EventKind.BUILD_START)
            .build();

    private final RunService     runService;
    private final StatusReporter reporter;

    public BuildStartHandler(RunService runService, StatusReporter reporter) {
        this.runService = runService;
        this.reporter   = reporter;
    }

    @Override
    public HandlerDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public TaskResult run(HandlerContext ctx) {
        List<Target> targets = ResultTargets.matching(runService, TargetKind.BUILD, ctx.event());
        for (Target target : targets) {
            if (target.isTerminal()) continue;
            reporter.report(ctx.event().repoUrl(), target.getRun().getCommitSha(),
                    CheckNames.of(CheckNames.RPM_BUILD, target.getTargetKey(), ctx.jobConfig().identifier()),
                    CommitState.RUNNING, "Build is in progress...", ctx.event().resultUrl());
        }
        return TaskResult.ok("Build " + ctx.event().correlationId() + " started");
    }
}
