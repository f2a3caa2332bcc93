package com.flowpilot.scheduler.queue.database;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Queue operations over the queued_jobs table.
 */
public interface QueuedJobRepository extends JpaRepository<QueuedJob, String> {

    /**
     * Claim candidate: the best ready row nobody else holds.
     *
     * PESSIMISTIC_WRITE with lock timeout -2 is rendered by Hibernate as
     * SELECT ... FOR UPDATE SKIP LOCKED on Postgres, so concurrent workers
     * each get a different row without blocking on one another.
     *
     * Must run inside a transaction that updates the row before committing.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT j FROM QueuedJob j
            WHERE j.state = :state
              AND j.availableAt <= :now
            ORDER BY j.priority ASC, j.availableAt ASC, j.createdAt ASC
            LIMIT 1
            """)
    Optional<QueuedJob> findNextReady(@Param("state") QueuedJobState state, @Param("now") Instant now);

    /**
     * Insert-or-replace by id in one statement, so two producers adding the
     * same id concurrently end with a single row.
     *
     * cron_expression and timezone are null for non-repeating jobs; the CASTs
     * give those untyped null parameters a column type.
     */
    @Modifying(clearAutomatically = true)
    @Query(value = """
            INSERT INTO queued_jobs (id, type, priority, state, data_json, available_at,
                                     cron_expression, timezone, failure_count, revision,
                                     worker_id, claimed_at, created_at, updated_at)
            VALUES (:id, :type, :priority, 'PENDING', :dataJson, :availableAt,
                    CAST(:cronExpression AS VARCHAR), CAST(:timezone AS VARCHAR), :failureCount, 1,
                    NULL, NULL, :now, :now)
            ON CONFLICT (id) DO UPDATE SET
                type            = EXCLUDED.type,
                priority        = EXCLUDED.priority,
                state           = 'PENDING',
                data_json       = EXCLUDED.data_json,
                available_at    = EXCLUDED.available_at,
                cron_expression = EXCLUDED.cron_expression,
                timezone        = EXCLUDED.timezone,
                failure_count   = EXCLUDED.failure_count,
                revision        = queued_jobs.revision + 1,
                worker_id       = NULL,
                claimed_at      = NULL,
                updated_at      = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsert(@Param("id") String id,
               @Param("type") String type,
               @Param("priority") int priority,
               @Param("dataJson") String dataJson,
               @Param("availableAt") Instant availableAt,
               @Param("cronExpression") String cronExpression,
               @Param("timezone") String timezone,
               @Param("failureCount") int failureCount,
               @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM QueuedJob j WHERE j.id = :id AND j.revision = :revision")
    int deleteByIdAndRevision(@Param("id") String id, @Param("revision") long revision);

    /** Both failure counter updates only touch the revision the worker claimed. */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE QueuedJob j SET j.failureCount = 0, j.updatedAt = :now
            WHERE j.id = :id AND j.revision = :revision
            """)
    int resetFailureCount(@Param("id") String id, @Param("revision") long revision, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE QueuedJob j SET j.failureCount = j.failureCount + 1, j.updatedAt = :now
            WHERE j.id = :id AND j.revision = :revision
            """)
    int incrementFailureCount(@Param("id") String id, @Param("revision") long revision, @Param("now") Instant now);

    /** RUNNING rows claimed before the cutoff; their worker is presumed dead. */
    List<QueuedJob> findByStateAndClaimedAtBefore(QueuedJobState state, Instant cutoff);
}
