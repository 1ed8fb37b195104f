package com.forgebot.worker.handler;

import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.jobs.JobType;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Static metadata a handler registers with: which jobs it runs for, which
 * jobs it is a prerequisite of, and what wakes it up.
 *
 * Immutable; handlers return the same instance for their whole lifetime.
 */
public record HandlerDescriptor(
        String         name,
        Set<JobType>   configuredAs,
        Set<JobType>   requiredFor,
        Set<EventKind> reactsTo,
        Set<String>    commentCommands,
        Set<String>    checkRerunPrefixes) {

    public HandlerDescriptor {
        Objects.requireNonNull(name, "name");
        configuredAs       = Set.copyOf(configuredAs);
        requiredFor        = Set.copyOf(requiredFor);
        reactsTo           = Set.copyOf(reactsTo);
        commentCommands    = Set.copyOf(commentCommands);
        checkRerunPrefixes = Set.copyOf(checkRerunPrefixes);
    }

    /** True if the event kind is, or descends from, one of the registered kinds. */
    public boolean reactsTo(EventKind kind) {
        return reactsTo.stream().anyMatch(kind::isA);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private Set<JobType>   configuredAs       = Set.of();
        private Set<JobType>   requiredFor        = Set.of();
        private Set<EventKind> reactsTo           = Set.of();
        private Set<String>    commentCommands    = Set.of();
        private Set<String>    checkRerunPrefixes = Set.of();

        private Builder(String name) { this.name = name; }

        public Builder configuredAs(JobType... types) {
            this.configuredAs = Set.copyOf(Arrays.asList(types));
            return this;
        }

        public Builder requiredFor(JobType... types) {
            this.requiredFor = Set.copyOf(Arrays.asList(types));
            return this;
        }

        public Builder reactsTo(EventKind... kinds) {
            this.reactsTo = Set.copyOf(Arrays.asList(kinds));
            return this;
        }

        public Builder commentCommands(String... commands) {
            this.commentCommands = Set.copyOf(Arrays.asList(commands));
            return this;
        }

        public Builder checkRerunPrefixes(String... prefixes) {
            this.checkRerunPrefixes = Set.copyOf(Arrays.asList(prefixes));
            return this;
        }

        public HandlerDescriptor build() {
            return new HandlerDescriptor(name, configuredAs, requiredFor, reactsTo,
                    commentCommands, checkRerunPrefixes);
        }
    }
}
