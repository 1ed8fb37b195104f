package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.JobOutcome;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.RunStatus;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetStatus;
import com.forgebot.worker.service.TargetStateMachine;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.lenient;

/**
 * Makes a mocked {@link TargetStateMachine} move Targets in memory following
 * the real predecessor rules, so handler tests can assert on final statuses.
 */
final class StateMachineStubs {

    private StateMachineStubs() {}

    static void realistic(TargetStateMachine machine, Function<Run, List<Target>> targetsOfRun) {
        lenient().when(machine.start(any())).thenAnswer(inv -> move(inv.getArgument(0), TargetStatus.RUNNING));
        lenient().when(machine.retry(any())).thenAnswer(inv -> move(inv.getArgument(0), TargetStatus.RETRY));
        lenient().when(machine.submit(any(), nullable(String.class), nullable(String.class))).thenAnswer(inv -> {
            Target t = inv.getArgument(0);
            if (!move(t, TargetStatus.SUBMITTED)) return false;
            t.setCorrelationId(inv.getArgument(1));
            t.setResultUrl(inv.getArgument(2));
            return true;
        });
        lenient().when(machine.fail(any(), nullable(String.class))).thenAnswer(inv -> {
            Target t = inv.getArgument(0);
            if (!move(t, TargetStatus.ERROR)) return false;
            t.setErrorMessage(inv.getArgument(1));
            return true;
        });
        lenient().when(machine.complete(any(), any())).thenAnswer(inv -> {
            JobOutcome outcome = inv.getArgument(1);
            TargetStatus to = switch (outcome) {
                case SUCCESS -> TargetStatus.SUCCESS;
                case FAILURE -> TargetStatus.FAILURE;
                case ERROR   -> TargetStatus.ERROR;
            };
            return move(inv.getArgument(0), to);
        });
        lenient().doAnswer(inv -> {
            Target t = inv.getArgument(0);
            t.setLogs(inv.getArgument(1));
            t.setFinishedAt(Instant.now());
            return null;
        }).when(machine).finish(any(), nullable(String.class));
        lenient().when(machine.aggregate(any())).thenAnswer(inv -> {
            Run run = inv.getArgument(0);
            RunStatus status = TargetStateMachine.aggregateOf(targetsOfRun.apply(run));
            run.setStatus(status);
            return status;
        });
    }

    private static boolean move(Target target, TargetStatus to) {
        if (!target.getStatus().canMoveTo(to, target.getKind())) {
            return false;
        }
        target.setStatus(to);
        return true;
    }

}
