package com.forgebot.worker.event;

/** Final outcome of an external build or test job. */
public enum JobOutcome {
    SUCCESS,
    FAILURE,
    ERROR
}
