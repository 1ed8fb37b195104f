package com.forgebot.worker.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TargetStatusTest {

    @Test
    void submitted_isTerminalOnlyForOneShotTargets() {
        assertThat(TargetStatus.SUBMITTED.isTerminal(TargetKind.PROPOSE_DOWNSTREAM)).isTrue();
        assertThat(TargetStatus.SUBMITTED.isTerminal(TargetKind.BUILD)).isFalse();
        assertThat(TargetStatus.ERROR.isTerminal(TargetKind.TEST_RUN)).isTrue();
        assertThat(TargetStatus.RETRY.isTerminal(TargetKind.PROPOSE_DOWNSTREAM)).isFalse();
    }

    @Test
    void terminalStatuses_neverMoveAgain() {
        for (TargetKind kind : TargetKind.values()) {
            for (TargetStatus from : TargetStatus.values()) {
                if (!from.isTerminal(kind)) continue;
                for (TargetStatus to : TargetStatus.values()) {
                    assertThat(from.canMoveTo(to, kind))
                            .as("%s %s -> %s", kind, from, to)
                            .isFalse();
                }
            }
        }
    }

    @Test
    void retry_reentersRunning() {
        assertThat(TargetStatus.RETRY.canMoveTo(TargetStatus.RUNNING, TargetKind.PROPOSE_DOWNSTREAM)).isTrue();
        assertThat(TargetStatus.RUNNING.canMoveTo(TargetStatus.RETRY, TargetKind.PROPOSE_DOWNSTREAM)).isTrue();
        assertThat(TargetStatus.QUEUED.canMoveTo(TargetStatus.RETRY, TargetKind.PROPOSE_DOWNSTREAM)).isFalse();
    }

    @Test
    void submittedTrackedTarget_completesOrErrors() {
        assertThat(TargetStatus.SUBMITTED.canMoveTo(TargetStatus.SUCCESS, TargetKind.BUILD)).isTrue();
        assertThat(TargetStatus.SUBMITTED.canMoveTo(TargetStatus.ERROR, TargetKind.TEST_RUN)).isTrue();
        assertThat(TargetStatus.SUBMITTED.canMoveTo(TargetStatus.RUNNING, TargetKind.BUILD)).isFalse();
    }
}
