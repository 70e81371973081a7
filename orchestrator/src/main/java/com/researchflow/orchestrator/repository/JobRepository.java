package com.researchflow.orchestrator.repository;

import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.model.JobStatus;
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
import java.util.UUID;

/**
 * CRUD + queue queries for the jobs table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Claim the oldest claimable job.
     *
     * A row is claimable when it is QUEUED, or ACTIVE with a retry scheduled,
     * and its availability time has passed. The lock timeout hint of -2 makes
     * Hibernate render FOR UPDATE SKIP LOCKED, so concurrent workers never
     * block on each other or claim the same row.
     *
     * Must run inside a @Transactional service method; the caller marks the
     * row claimed before the transaction commits and releases the lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT j FROM Job j
            WHERE j.availableAt <= :now
              AND (j.status = :queued OR (j.status = :active AND j.retryScheduled = true))
            ORDER BY j.availableAt ASC, j.createdAt ASC
            LIMIT 1
            """)
    Optional<Job> claimNext(@Param("now") Instant now,
                            @Param("queued") JobStatus queued,
                            @Param("active") JobStatus active);

    default Optional<Job> claimNext(Instant now) {
        return claimNext(now, JobStatus.QUEUED, JobStatus.ACTIVE);
    }

    /**
     * Load a job and hold its row lock until the transaction ends. Used for
     * terminal transitions and cancellation so they serialize with claims.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /** The live (non-failed) job for an idempotency key, if any. */
    Optional<Job> findFirstByIdempotencyKeyAndStatusNotOrderByCreatedAtDesc(String idempotencyKey,
                                                                              JobStatus excluded);

    /**
     * Running jobs whose worker stopped heartbeating before {@code cutoff},
     * locked for redelivery. Rows another transaction holds are skipped.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = :active
              AND j.retryScheduled = false
              AND j.heartbeatAt < :cutoff
            """)
    List<Job> lockStalled(@Param("cutoff") Instant cutoff, @Param("active") JobStatus active);

    default List<Job> lockStalled(Instant cutoff) {
        return lockStalled(cutoff, JobStatus.ACTIVE);
    }

    @Query("SELECT j.cancelRequested FROM Job j WHERE j.id = :id")
    Optional<Boolean> findCancelRequestedById(@Param("id") UUID id);

    /**
     * Progress and heartbeat are written with a targeted UPDATE so a worker's
     * detached copy of the row never overwrites a concurrent cancel request.
     * Only the job's current attempt matches.
     *
     * @return rows updated, 0 when the attempt is no longer current
     */
    @Modifying
    @Query("""
            UPDATE Job j
            SET j.progress = :progress, j.heartbeatAt = :now, j.updatedAt = :now
            WHERE j.id = :id
              AND j.attemptCount = :attempt
              AND j.retryScheduled = false
            """)
    int updateProgress(@Param("id") UUID id, @Param("attempt") int attempt,
                       @Param("progress") int progress, @Param("now") Instant now);
}
