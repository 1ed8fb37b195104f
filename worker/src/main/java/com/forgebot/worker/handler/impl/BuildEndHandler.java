package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.event.JobOutcome;
import com.forgebot.worker.external.StatusReporter;
import com.forgebot.worker.handler.CheckNames;
import com.forgebot.worker.handler.HandlerDescriptor;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.service.RunService;
import com.forgebot.worker.service.TargetStateMachine;
import org.springframework.stereotype.Component;

/** A build finished, reported by the build farm or replayed by the babysitter. */
@Component
public class BuildEndHandler extends CompletionHandler {

    public static final String NAME = "build_end";

    static final HandlerDescriptor DESCRIPTOR = HandlerDescriptor.builder(NAME)
            .configuredAs(JobType.BUILD)
            .requiredFor(JobType.TESTS)
            .reactsTo(EventKind.BUILD_END)
            .build();

    public BuildEndHandler(RunService runService, TargetStateMachine stateMachine,
                           StatusReporter reporter) {
        super(TargetKind.BUILD, CheckNames.RPM_BUILD, runService, stateMachine, reporter);
    }

    @Override
    public HandlerDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected String description(JobOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> "RPMs were built successfully.";
            case FAILURE -> "RPMs failed to be built.";
            case ERROR   -> "Build ended in an error.";
        };
    }
}
