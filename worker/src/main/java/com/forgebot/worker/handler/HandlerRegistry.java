package com.forgebot.worker.handler;

import com.forgebot.worker.event.CommentCommand;
import com.forgebot.worker.event.Event;
import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.jobs.PackageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Classification registry: maps a normalized event to the handlers that must
 * run for it.
 *
 * All {@link JobHandler} beans are collected at startup and indexed along
 * four axes:
 * <ol>
 *   <li>job type → handlers configured as that type</li>
 *   <li>job type → handlers that are a prerequisite of that type</li>
 *   <li>handler → event kinds it reacts to (is-a compatible)</li>
 *   <li>comment command / check-rerun prefix → handlers</li>
 * </ol>
 * The maps are built once in the constructor and never change afterwards, so
 * lookups need no synchronization.
 */
@Component
public class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, JobHandler>                    handlers;
    private final List<HandlerDescriptor>                    descriptors;
    private final Map<JobType, List<HandlerDescriptor>>      configuredAs;
    private final Map<JobType, List<HandlerDescriptor>>      requiredFor;
    private final Map<String, List<HandlerDescriptor>>       byCommentCommand;
    private final Map<String, List<HandlerDescriptor>>       byCheckRerunPrefix;
    private final DependencyResolver                         resolver;
    private final String                                     commentPrefix;

    public HandlerRegistry(List<JobHandler> allHandlers,
                           DependencyResolver resolver,
                           @Value("${forgebot.comment-prefix:/packit}") String commentPrefix) {
        this.resolver      = resolver;
        this.commentPrefix = commentPrefix;

        Map<String, JobHandler> byName = new LinkedHashMap<>();
        allHandlers.stream()
                .sorted(Comparator.comparing(h -> h.descriptor().name()))
                .forEach(h -> {
                    String name = h.descriptor().name();
                    if (byName.putIfAbsent(name, h) != null) {
                        throw new IllegalStateException("Duplicate handler name: " + name);
                    }
                });
        this.handlers    = Map.copyOf(byName);
        this.descriptors = byName.values().stream().map(JobHandler::descriptor).toList();

        this.configuredAs       = index(descriptors, HandlerDescriptor::configuredAs);
        this.requiredFor        = index(descriptors, HandlerDescriptor::requiredFor);
        this.byCommentCommand   = index(descriptors, HandlerDescriptor::commentCommands);
        this.byCheckRerunPrefix = index(descriptors, HandlerDescriptor::checkRerunPrefixes);

        for (HandlerDescriptor d : descriptors) {
            log.info("Registered handler '{}' configured-as={} required-for={} reacts-to={}",
                    d.name(), d.configuredAs(), d.requiredFor(), d.reactsTo());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public JobHandler get(String name) {
        JobHandler handler = handlers.get(name);
        if (handler == null) {
            throw new HandlerNotFoundException(name);
        }
        return handler;
    }

    /** All registered descriptors, sorted by name. */
    public List<HandlerDescriptor> descriptors() {
        return descriptors;
    }

    public List<HandlerDescriptor> configuredAs(JobType type) {
        return configuredAs.getOrDefault(type, List.of());
    }

    public List<HandlerDescriptor> requiredFor(JobType type) {
        return requiredFor.getOrDefault(type, List.of());
    }

    public String commentPrefix() {
        return commentPrefix;
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    /**
     * Select every (handler, job) pair that must run for the event.
     *
     * Explicitly configured jobs come first, in the package's declaration
     * order; prerequisite jobs synthesized by the {@link DependencyResolver}
     * follow. The result is deterministic for identical input.
     */
    public List<HandlerMatch> handlersFor(Event event, PackageConfig packageConfig) {
        List<HandlerDescriptor> candidates = candidates(event);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<JobConfig> jobs = packageConfig.jobs().stream()
                .filter(job -> event.trigger() == null || job.trigger() == event.trigger())
                .filter(job -> !event.kind().isResult()
                        || Objects.equals(job.identifier(), event.identifier()))
                .toList();

        Set<HandlerMatch> matches = new LinkedHashSet<>();
        for (JobConfig job : jobs) {
            for (HandlerDescriptor d : candidates) {
                if (d.configuredAs().contains(job.type())) {
                    matches.add(new HandlerMatch(d, job));
                }
            }
        }

        for (JobConfig synthesized : resolver.resolve(jobs, requiredFor)) {
            for (HandlerDescriptor d : candidates) {
                if (d.configuredAs().contains(synthesized.type())
                        && d.requiredFor().contains(synthesized.derivedFrom())) {
                    matches.add(new HandlerMatch(d, synthesized));
                }
            }
        }

        log.debug("Event {} matched {} handler(s)", event.kind(), matches.size());
        return List.copyOf(matches);
    }

    /** Descriptors that react to the event, narrowed by comment command or check name. */
    private List<HandlerDescriptor> candidates(Event event) {
        Collection<HandlerDescriptor> pool;
        if (event.kind().isComment()) {
            Optional<CommentCommand> command = CommentCommand.parse(event.comment(), commentPrefix);
            if (command.isEmpty()) {
                log.debug("Comment carries no '{}' command, ignoring", commentPrefix);
                return List.of();
            }
            pool = byCommentCommand.getOrDefault(command.get().command(), List.of());
        } else if (event.kind().isCheckRerun()) {
            String prefix = event.checkNamePrefix();
            pool = prefix == null ? List.of() : byCheckRerunPrefix.getOrDefault(prefix, List.of());
        } else {
            pool = descriptors;
        }
        return pool.stream().filter(d -> d.reactsTo(event.kind())).toList();
    }

    private static <K> Map<K, List<HandlerDescriptor>> index(
            List<HandlerDescriptor> descriptors,
            Function<HandlerDescriptor, Set<K>> keys) {
        Map<K, List<HandlerDescriptor>> map = new LinkedHashMap<>();
        for (HandlerDescriptor d : descriptors) {
            for (K key : keys.apply(d)) {
                map.computeIfAbsent(key, k -> new ArrayList<>()).add(d);
            }
        }
        Map<K, List<HandlerDescriptor>> frozen = new LinkedHashMap<>();
        map.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Map.copyOf(frozen);
    }
}
