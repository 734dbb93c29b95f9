package com.lucidreview.repository;

import com.lucidreview.entity.AgentRun;
import com.lucidreview.entity.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link AgentRun} entities.
 * <p>
 * Status changes are conditional updates guarded by the expected current status, so a run
 * that already reached a terminal state is never overwritten. Each method returns the number
 * of rows changed (0 or 1).
 */
public interface AgentRunRepository extends JpaRepository<AgentRun, UUID> {

    @Query("select r.status from AgentRun r where r.id = :id")
    Optional<RunStatus> findStatusById(@Param("id") UUID id);

    List<AgentRun> findByCaseNumberOrderByStartedAtDesc(String caseNumber);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AgentRun r
               set r.status = :running, r.modelId = :modelId, r.promptVersion = :promptVersion, r.startedAt = :startedAt
             where r.id = :id and r.status = :pending
            """)
    int transition(@Param("id") UUID id,
                   @Param("pending") RunStatus pending,
                   @Param("running") RunStatus running,
                   @Param("modelId") String modelId,
                   @Param("promptVersion") String promptVersion,
                   @Param("startedAt") OffsetDateTime startedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AgentRun r
               set r.status = :completed, r.determination = :determination, r.totalTurns = :totalTurns,
                   r.inputTokensTotal = :inputTokens, r.outputTokensTotal = :outputTokens, r.completedAt = :completedAt
             where r.id = :id and r.status = :running
            """)
    int complete(@Param("id") UUID id,
                 @Param("running") RunStatus running,
                 @Param("completed") RunStatus completed,
                 @Param("determination") String determination,
                 @Param("totalTurns") int totalTurns,
                 @Param("inputTokens") long inputTokens,
                 @Param("outputTokens") long outputTokens,
                 @Param("completedAt") OffsetDateTime completedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AgentRun r
               set r.status = :target, r.error = :error, r.completedAt = :completedAt
             where r.id = :id and r.status in :from
            """)
    int finish(@Param("id") UUID id,
               @Param("from") Collection<RunStatus> from,
               @Param("target") RunStatus target,
               @Param("error") String error,
               @Param("completedAt") OffsetDateTime completedAt);
}
