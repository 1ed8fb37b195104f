package com.forgebot.worker.external;

/** Commit status states understood by the forge. */
public enum CommitState {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE
}
