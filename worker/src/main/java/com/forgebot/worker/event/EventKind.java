package com.forgebot.worker.event;

import com.forgebot.worker.jobs.JobTrigger;

/**
 * Kinds of normalized events, arranged in an is-a hierarchy.
 *
 * A handler registered for a general kind (e.g. COMMENT) also reacts to every
 * more specific kind below it (ISSUE_COMMENT, PULL_REQUEST_COMMENT, ...).
 *
 *   COMMENT       → ISSUE_COMMENT, PULL_REQUEST_COMMENT → DIST_GIT_PR_COMMENT
 *   PUSH          → DIST_GIT_PUSH
 *   CHECK_RERUN   → CHECK_RERUN_PULL_REQUEST, CHECK_RERUN_COMMIT, CHECK_RERUN_RELEASE
 *   BUILD_STATUS  → BUILD_START, BUILD_END
 */
public enum EventKind {
    PULL_REQUEST(null, JobTrigger.PULL_REQUEST),
    PUSH(null, JobTrigger.COMMIT),
    DIST_GIT_PUSH(PUSH, JobTrigger.COMMIT),
    RELEASE(null, JobTrigger.RELEASE),

    COMMENT(null, null),
    ISSUE_COMMENT(COMMENT, JobTrigger.RELEASE),
    PULL_REQUEST_COMMENT(COMMENT, JobTrigger.PULL_REQUEST),
    DIST_GIT_PR_COMMENT(PULL_REQUEST_COMMENT, JobTrigger.COMMIT),

    CHECK_RERUN(null, null),
    CHECK_RERUN_PULL_REQUEST(CHECK_RERUN, JobTrigger.PULL_REQUEST),
    CHECK_RERUN_COMMIT(CHECK_RERUN, JobTrigger.COMMIT),
    CHECK_RERUN_RELEASE(CHECK_RERUN, JobTrigger.RELEASE),

    // Result kinds carry no default trigger: it comes from the Run they report on.
    BUILD_STATUS(null, null),
    BUILD_START(BUILD_STATUS, null),
    BUILD_END(BUILD_STATUS, null),
    TEST_RESULTS(null, null);

    private final EventKind  parent;
    private final JobTrigger defaultTrigger;

    EventKind(EventKind parent, JobTrigger defaultTrigger) {
        this.parent         = parent;
        this.defaultTrigger = defaultTrigger;
    }

    /** True if this kind equals {@code other} or descends from it. */
    public boolean isA(EventKind other) {
        for (EventKind k = this; k != null; k = k.parent) {
            if (k == other) return true;
        }
        return false;
    }

    public JobTrigger defaultTrigger() { return defaultTrigger; }

    public boolean isComment()    { return isA(COMMENT); }
    public boolean isCheckRerun() { return isA(CHECK_RERUN); }

    /** Result events report on one specific job and are matched by its identifier. */
    public boolean isResult() {
        return isA(BUILD_STATUS) || this == TEST_RESULTS;
    }
}
