package com.forgebot.worker.event;

import com.forgebot.worker.jobs.JobTrigger;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, already-normalized description of something that happened to a
 * repository (webhook, comment, check re-run, build/test callback).
 *
 * @param kind             event kind, classified by is-a compatibility
 * @param trigger          job trigger; defaults to {@link EventKind#defaultTrigger()}
 * @param repoUrl          upstream or dist-git repository URL
 * @param commitSha        head commit, if any
 * @param prId             pull-request number, if any
 * @param tagName          release tag, if any
 * @param gitRef           pushed branch (or the PR target branch for dist-git PR comments)
 * @param actor            user who caused the event
 * @param comment          comment body for comment events
 * @param checkName        full check name for check re-runs, e.g. "rpm-build:fedora-39-x86_64"
 * @param prAuthor         author of the PR a dist-git push originates from; null for direct pushes
 * @param identifier       job identifier reported by result events
 * @param correlationId    external build / pipeline id reported by result events
 * @param targetKey        chroot or branch a result event reports on
 * @param outcome          outcome reported by result events
 * @param resultUrl        link to the external result page
 * @param branchesOverride restricts Targets to these branches when present
 * @param payload          raw payload, opaque to the core
 */
public record Event(
        EventKind           kind,
        JobTrigger          trigger,
        String              repoUrl,
        String              commitSha,
        Integer             prId,
        String              tagName,
        String              gitRef,
        String              actor,
        String              comment,
        String              checkName,
        String              prAuthor,
        String              identifier,
        String              correlationId,
        String              targetKey,
        JobOutcome          outcome,
        String              resultUrl,
        Set<String>         branchesOverride,
        Map<String, Object> payload) {

    public Event {
        Objects.requireNonNull(kind, "kind");
        if (trigger == null) trigger = kind.defaultTrigger();
        branchesOverride = branchesOverride == null ? Set.of() : Set.copyOf(branchesOverride);
        payload          = payload == null ? Map.of() : Map.copyOf(payload);
    }

    /** The part of the check name before the first ':' ("rpm-build" for "rpm-build:f39"). */
    public String checkNamePrefix() {
        if (checkName == null) return null;
        int idx = checkName.indexOf(':');
        return idx < 0 ? checkName : checkName.substring(0, idx);
    }

    public static Builder builder(EventKind kind) {
        return new Builder(kind);
    }

    public static final class Builder {
        private final EventKind kind;
        private JobTrigger trigger;
        private String repoUrl;
        private String commitSha;
        private Integer prId;
        private String tagName;
        private String gitRef;
        private String actor;
        private String comment;
        private String checkName;
        private String prAuthor;
        private String identifier;
        private String correlationId;
        private String targetKey;
        private JobOutcome outcome;
        private String resultUrl;
        private Set<String> branchesOverride;
        private Map<String, Object> payload;

        private Builder(EventKind kind) { this.kind = kind; }

        public Builder trigger(JobTrigger v)           { this.trigger = v; return this; }
        public Builder repoUrl(String v)               { this.repoUrl = v; return this; }
        public Builder commitSha(String v)             { this.commitSha = v; return this; }
        public Builder prId(Integer v)                 { this.prId = v; return this; }
        public Builder tagName(String v)               { this.tagName = v; return this; }
        public Builder gitRef(String v)                { this.gitRef = v; return this; }
        public Builder actor(String v)                 { this.actor = v; return this; }
        public Builder comment(String v)               { this.comment = v; return this; }
        public Builder checkName(String v)             { this.checkName = v; return this; }
        public Builder prAuthor(String v)              { this.prAuthor = v; return this; }
        public Builder identifier(String v)            { this.identifier = v; return this; }
        public Builder correlationId(String v)         { this.correlationId = v; return this; }
        public Builder targetKey(String v)             { this.targetKey = v; return this; }
        public Builder outcome(JobOutcome v)           { this.outcome = v; return this; }
        public Builder resultUrl(String v)             { this.resultUrl = v; return this; }
        public Builder branchesOverride(Set<String> v) { this.branchesOverride = v; return this; }
        public Builder payload(Map<String, Object> v)  { this.payload = v; return this; }

        public Event build() {
            return new Event(kind, trigger, repoUrl, commitSha, prId, tagName, gitRef, actor,
                    comment, checkName, prAuthor, identifier, correlationId, targetKey,
                    outcome, resultUrl, branchesOverride, payload);
        }
    }
}
