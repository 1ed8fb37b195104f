package com.forgebot.worker.repository;

import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.UUID;

/**
 * CRUD + status updates for the runs table.
 */
public interface RunRepository extends JpaRepository<Run, UUID> {

    /** Write the aggregate status; finishedAt is null while the Run is still RUNNING. */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Run r
            SET r.status = :status, r.finishedAt = :finishedAt
            WHERE r.id = :id
            """)
    int updateStatus(@Param("id") UUID id,
                     @Param("status") RunStatus status,
                     @Param("finishedAt") Instant finishedAt);
}
