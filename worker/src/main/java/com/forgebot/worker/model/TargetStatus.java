package com.forgebot.worker.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a single Target.
 *
 * Transitions:
 *   QUEUED    → RUNNING | ERROR
 *   RUNNING   → SUBMITTED | RETRY | ERROR | SUCCESS | FAILURE
 *   RETRY     → RUNNING | ERROR         (picked up again by the next attempt)
 *   SUBMITTED → SUCCESS | FAILURE | ERROR   (tracked Targets only)
 *
 * RUNNING → RUNNING is allowed so a re-delivered invocation can restart a
 * Target its crashed predecessor left behind. Nothing ever moves backward.
 */
public enum TargetStatus {
    QUEUED,
    RUNNING,
    RETRY,
    SUBMITTED,
    SUCCESS,
    FAILURE,
    ERROR;

    public boolean isTerminal(TargetKind kind) {
        return switch (this) {
            case SUCCESS, FAILURE, ERROR -> true;
            case SUBMITTED               -> !kind.isTracked();
            default                      -> false;
        };
    }

    /** Statuses a Target of the given kind may be in right before moving to this one. */
    public Set<TargetStatus> predecessors(TargetKind kind) {
        Set<TargetStatus> from = switch (this) {
            case QUEUED             -> EnumSet.noneOf(TargetStatus.class);
            case RUNNING            -> EnumSet.of(QUEUED, RETRY, RUNNING);
            case RETRY, SUBMITTED   -> EnumSet.of(RUNNING);
            case SUCCESS, FAILURE   -> EnumSet.of(RUNNING);
            case ERROR              -> EnumSet.of(QUEUED, RUNNING, RETRY);
        };
        if (kind.isTracked() && (this == SUCCESS || this == FAILURE || this == ERROR)) {
            from.add(SUBMITTED);
        }
        return from;
    }

    public boolean canMoveTo(TargetStatus next, TargetKind kind) {
        return next.predecessors(kind).contains(this);
    }
}
