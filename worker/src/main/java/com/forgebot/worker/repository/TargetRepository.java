package com.forgebot.worker.repository;

import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.model.TargetStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Queries and status-conditioned updates for the targets table.
 *
 * Every status write carries the set of statuses the Target may currently
 * be in ({@code from}). The returned row count tells the caller whether the
 * write happened: 0 means another writer moved the Target first.
 */
public interface TargetRepository extends JpaRepository<Target, UUID> {

    /** Targets of a Run, in processing order. */
    List<Target> findByRunIdOrderByPositionAsc(UUID runId);

    /** Used by the reconciliation sweeps; the Run is fetched eagerly for replay. */
    @Query("""
            SELECT t FROM Target t JOIN FETCH t.run
            WHERE t.kind = :kind AND t.status IN :statuses
            ORDER BY t.createdAt ASC
            """)
    List<Target> findByKindAndStatusIn(@Param("kind") TargetKind kind,
                                       @Param("statuses") Collection<TargetStatus> statuses);

    @Query("""
            SELECT t FROM Target t JOIN FETCH t.run
            WHERE t.kind = :kind AND t.correlationId = :correlationId
            ORDER BY t.position ASC
            """)
    List<Target> findByKindAndCorrelationId(@Param("kind") TargetKind kind,
                                            @Param("correlationId") String correlationId);

    // ------------------------------------------------------------------
    // Status-conditioned updates
    // ------------------------------------------------------------------

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Target t
            SET t.status = :to
            WHERE t.id = :id AND t.status IN :from
            """)
    int transition(@Param("id") UUID id,
                   @Param("from") Collection<TargetStatus> from,
                   @Param("to") TargetStatus to);

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Target t
            SET t.status = com.forgebot.worker.model.TargetStatus.RUNNING, t.startedAt = :at
            WHERE t.id = :id AND t.status IN :from
            """)
    int markStarted(@Param("id") UUID id,
                    @Param("from") Collection<TargetStatus> from,
                    @Param("at") Instant at);

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Target t
            SET t.status = com.forgebot.worker.model.TargetStatus.SUBMITTED,
                t.submittedAt = :at,
                t.correlationId = :correlationId,
                t.resultUrl = :resultUrl
            WHERE t.id = :id AND t.status IN :from
            """)
    int markSubmitted(@Param("id") UUID id,
                      @Param("from") Collection<TargetStatus> from,
                      @Param("correlationId") String correlationId,
                      @Param("resultUrl") String resultUrl,
                      @Param("at") Instant at);

    /** Move to a terminal status (SUCCESS, FAILURE or ERROR) and stamp the finish time. */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Target t
            SET t.status = :to, t.finishedAt = :at, t.errorMessage = :errorMessage
            WHERE t.id = :id AND t.status IN :from
            """)
    int markTerminal(@Param("id") UUID id,
                     @Param("from") Collection<TargetStatus> from,
                     @Param("to") TargetStatus to,
                     @Param("errorMessage") String errorMessage,
                     @Param("at") Instant at);

    /** Unconditioned: the finish timestamp and logs are written on every exit path. */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Target t
            SET t.finishedAt = :at, t.logs = :logs
            WHERE t.id = :id
            """)
    int recordFinish(@Param("id") UUID id,
                     @Param("logs") String logs,
                     @Param("at") Instant at);
}
