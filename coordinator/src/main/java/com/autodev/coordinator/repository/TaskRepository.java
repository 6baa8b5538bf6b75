package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.model.TaskStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + claim/transition queries for the tasks table.
 *
 * Every state change that races with another worker is a conditional
 * UPDATE (returns the affected row count) or a row-locking SELECT that the
 * service mutates inside the same transaction.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    /** Lock timeout -2 is Hibernate's SKIP LOCKED. */
    String SKIP_LOCKED = "-2";

    String CLAIMABLE = """
            t.status = com.autodev.coordinator.model.TaskStatus.PENDING
            AND (t.notBefore IS NULL OR t.notBefore <= :now)
            AND (t.gateApprovalId IS NULL OR EXISTS (
                    SELECT a.id FROM ApprovalItem a
                    WHERE a.id = t.gateApprovalId
                      AND a.status = com.autodev.coordinator.model.ApprovalStatus.APPROVED))
            """;

    /**
     * Lock the best claimable task for a worker that accepts the given types.
     *
     * SELECT FOR UPDATE SKIP LOCKED means:
     *   - FOR UPDATE  : no other transaction can see the row as claimable until we commit
     *   - SKIP LOCKED : rows already locked by another claimer are skipped, not waited on
     *
     * Must run inside the @Transactional claim in TaskQueueService, which sets
     * status = CLAIMED before the transaction commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = SKIP_LOCKED))
    @Query("SELECT t FROM Task t WHERE " + CLAIMABLE + """
            AND (t.targetWorker = :workerId
                 OR (t.targetWorker IS NULL AND t.type IN :types))
            ORDER BY t.priority DESC, t.createdAt ASC
            LIMIT 1
            """)
    Optional<Task> lockNextClaimable(@Param("workerId") String workerId,
                                     @Param("types") Collection<String> types,
                                     @Param("now") Instant now);

    /** Same as {@link #lockNextClaimable} for workers that accept every type. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = SKIP_LOCKED))
    @Query("SELECT t FROM Task t WHERE " + CLAIMABLE + """
            AND (t.targetWorker IS NULL OR t.targetWorker = :workerId)
            ORDER BY t.priority DESC, t.createdAt ASC
            LIMIT 1
            """)
    Optional<Task> lockNextClaimableAnyType(@Param("workerId") String workerId,
                                            @Param("now") Instant now);

    /**
     * Move a CLAIMED task held by workerId into a terminal state.
     * Returns 0 when the caller is not the holder or the task is not CLAIMED.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.status = :status, t.resultJson = :resultJson, t.error = :error, t.completedAt = :now
             WHERE t.id = :id
               AND t.assignedTo = :workerId
               AND t.status = com.autodev.coordinator.model.TaskStatus.CLAIMED
            """)
    int finishIfHeld(@Param("id") UUID id,
                     @Param("workerId") String workerId,
                     @Param("status") TaskStatus status,
                     @Param("resultJson") String resultJson,
                     @Param("error") String error,
                     @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.heartbeatAt = :now
             WHERE t.id = :id
               AND t.assignedTo = :workerId
               AND t.status = com.autodev.coordinator.model.TaskStatus.CLAIMED
            """)
    int touchIfHeld(@Param("id") UUID id, @Param("workerId") String workerId, @Param("now") Instant now);

    /** Voluntary hand-back: the task goes back to PENDING without consuming a retry. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.status = com.autodev.coordinator.model.TaskStatus.PENDING,
                   t.assignedTo = NULL, t.claimedAt = NULL, t.heartbeatAt = NULL,
                   t.error = :reason
             WHERE t.id = :id
               AND t.assignedTo = :workerId
               AND t.status = com.autodev.coordinator.model.TaskStatus.CLAIMED
            """)
    int releaseIfHeld(@Param("id") UUID id, @Param("workerId") String workerId, @Param("reason") String reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.status = com.autodev.coordinator.model.TaskStatus.CANCELLED,
                   t.error = :reason, t.completedAt = :now
             WHERE t.id = :id
               AND t.status IN (com.autodev.coordinator.model.TaskStatus.PENDING,
                                com.autodev.coordinator.model.TaskStatus.CLAIMED)
            """)
    int cancelIfLive(@Param("id") UUID id, @Param("reason") String reason, @Param("now") Instant now);

    /** Cancel every still-pending task gated on a rejected approval item. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.status = com.autodev.coordinator.model.TaskStatus.CANCELLED,
                   t.error = :reason, t.completedAt = :now
             WHERE t.gateApprovalId = :approvalId
               AND t.status = com.autodev.coordinator.model.TaskStatus.PENDING
            """)
    int cancelGatedBy(@Param("approvalId") UUID approvalId, @Param("reason") String reason, @Param("now") Instant now);

    /**
     * Lock CLAIMED tasks whose heartbeat is older than 'cutoff'.
     * Rows a worker is touching right now are skipped and picked up next sweep.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = SKIP_LOCKED))
    @Query("""
            SELECT t FROM Task t
            WHERE t.status = com.autodev.coordinator.model.TaskStatus.CLAIMED
              AND t.heartbeatAt < :cutoff
            ORDER BY t.heartbeatAt ASC
            """)
    List<Task> lockStaleClaims(@Param("cutoff") Instant cutoff);

    Optional<Task> findFirstByTypeAndDedupKeyAndStatusIn(String type, String dedupKey, Collection<TaskStatus> statuses);

    List<Task> findByAssignedToAndStatusOrderByClaimedAtAsc(String assignedTo, TaskStatus status);

    List<Task> findByParentTaskIdOrderByCreatedAtAsc(UUID parentTaskId);

    @Query("""
            SELECT t FROM Task t
            WHERE (:status IS NULL OR t.status = :status)
              AND (:type IS NULL OR t.type = :type)
              AND (:repoRef IS NULL OR t.repoRef = :repoRef)
            ORDER BY t.priority DESC, t.createdAt DESC
            """)
    List<Task> search(@Param("status") TaskStatus status,
                      @Param("type") String type,
                      @Param("repoRef") String repoRef,
                      Pageable page);

    // ------------------------------------------------------------------
    // Queue statistics
    // ------------------------------------------------------------------

    @Query("SELECT new com.autodev.coordinator.repository.StatusCount(t.status, COUNT(t)) FROM Task t GROUP BY t.status")
    List<StatusCount> countByStatus();

    @Query("""
            SELECT new com.autodev.coordinator.repository.KeyCount(t.type, COUNT(t))
            FROM Task t
            WHERE t.status = com.autodev.coordinator.model.TaskStatus.PENDING
            GROUP BY t.type
            """)
    List<KeyCount> countPendingByType();

    @Query("""
            SELECT new com.autodev.coordinator.repository.KeyCount(t.assignedTo, COUNT(t))
            FROM Task t
            WHERE t.status = com.autodev.coordinator.model.TaskStatus.CLAIMED
            GROUP BY t.assignedTo
            """)
    List<KeyCount> countClaimedByWorker();
}
