package com.forgebot.worker.model;

/**
 * Aggregate status of a Run, derived from its Targets.
 *
 *   RUNNING  : some Target is not terminal yet, or waits in RETRY
 *   FINISHED : every Target is terminal and none ended in ERROR
 *   ERROR    : every Target is terminal and at least one ended in ERROR
 */
public enum RunStatus {
    RUNNING,
    FINISHED,
    ERROR
}
