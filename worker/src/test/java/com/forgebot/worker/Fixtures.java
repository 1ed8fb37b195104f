package com.forgebot.worker;

import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.JobTrigger;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.model.TargetStatus;

import java.util.UUID;

/** Test object factories shared by the unit tests. */
public final class Fixtures {

    public static final String REPO = "https://github.com/org/repo.git";

    private Fixtures() {}

    public static Run run(String handler, JobType type, JobTrigger trigger) {
        Run run = new Run(handler, type, trigger);
        run.setRepoUrl(REPO);
        run.setCommitSha("abc123");
        return withId(run);
    }

    public static Target target(Run run, TargetKind kind, String key, int position, TargetStatus status) {
        Target target = withId(new Target(run, kind, key, position));
        target.setStatus(status);
        return target;
    }

    public static JobConfig job(JobType type, JobTrigger trigger, String... targets) {
        return JobConfig.of(type, trigger, targets);
    }

    /** Reflectively set the id, normally assigned by JPA on persist. */
    public static <T> T withId(T entity) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
