package com.forgebot.worker.external;

import com.forgebot.worker.event.JobOutcome;

import java.util.Map;

/**
 * Answer of an external build/test system to "what happened to job X?".
 *
 * @param subResults per-chroot outcomes when one external job covers several Targets
 */
public record ExternalJobStatus(State state, JobOutcome outcome,
                                Map<String, JobOutcome> subResults, String url) {

    public enum State { NOT_FOUND, PENDING, COMPLETED }

    public ExternalJobStatus {
        subResults = subResults == null ? Map.of() : Map.copyOf(subResults);
    }

    public static ExternalJobStatus notFound() {
        return new ExternalJobStatus(State.NOT_FOUND, null, null, null);
    }

    public static ExternalJobStatus pending() {
        return new ExternalJobStatus(State.PENDING, null, null, null);
    }

    public static ExternalJobStatus completed(JobOutcome outcome, String url) {
        return new ExternalJobStatus(State.COMPLETED, outcome, null, url);
    }

    /** Outcome for one Target key, falling back to the overall outcome. */
    public JobOutcome outcomeFor(String targetKey) {
        return subResults.getOrDefault(targetKey, outcome);
    }
}
