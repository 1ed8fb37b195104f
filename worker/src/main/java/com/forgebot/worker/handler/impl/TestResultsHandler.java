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

/** A test pipeline finished, reported by the test farm or replayed by the babysitter. */
@Component
public class TestResultsHandler extends CompletionHandler {

    public static final String NAME = "test_results";

    static final HandlerDescriptor DESCRIPTOR = HandlerDescriptor.builder(NAME)
            .configuredAs(JobType.TESTS)
            .reactsTo(EventKind.TEST_RESULTS)
            .build();

    public TestResultsHandler(RunService runService, TargetStateMachine stateMachine,
                              StatusReporter reporter) {
        super(TargetKind.TEST_RUN, CheckNames.TESTING_FARM, runService, stateMachine, reporter);
    }

    @Override
    public HandlerDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected String description(JobOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> "Tests passed.";
            case FAILURE -> "Tests failed.";
            case ERROR   -> "Tests could not be run.";
        };
    }
}
