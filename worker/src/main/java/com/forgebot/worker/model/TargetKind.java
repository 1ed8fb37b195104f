package com.forgebot.worker.model;

/**
 * What a Target stands for.
 *
 * One-shot Targets are done once the external operation is accepted.
 * Tracked Targets wait in SUBMITTED until the external build or test
 * system reports completion (by callback or reconciliation).
 */
public enum TargetKind {
    PROPOSE_DOWNSTREAM(false),
    BUILD(true),
    TEST_RUN(true);

    private final boolean tracked;

    TargetKind(boolean tracked) {
        this.tracked = tracked;
    }

    public boolean isTracked() {
        return tracked;
    }
}
