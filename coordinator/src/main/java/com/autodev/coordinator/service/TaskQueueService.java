package com.autodev.coordinator.service;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.model.TaskStatus;
import com.autodev.coordinator.repository.ApprovalItemRepository;
import com.autodev.coordinator.repository.KeyCount;
import com.autodev.coordinator.repository.StatusCount;
import com.autodev.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The shared backlog: create, claim, heartbeat, finish and reclaim tasks.
 *
 * All public methods that touch the DB are @Transactional so that
 * SELECT FOR UPDATE SKIP LOCKED and the following UPDATE are atomic.
 * Transitions out of CLAIMED are conditional updates keyed on the holder,
 * so a worker that lost its claim can never overwrite the new owner's work.
 */
@Service
public class TaskQueueService {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueService.class);

    static final int MIN_PRIORITY = 1;
    static final int MAX_PRIORITY = 10;

    private static final Set<TaskStatus> LIVE = EnumSet.of(TaskStatus.PENDING, TaskStatus.CLAIMED);

    private final TaskRepository         taskRepo;
    private final ApprovalItemRepository approvalRepo;
    private final CoordinatorProperties  props;
    private final CoordinatorMetrics     metrics;
    private final Clock                  clock;

    public TaskQueueService(TaskRepository taskRepo,
                            ApprovalItemRepository approvalRepo,
                            CoordinatorProperties props,
                            CoordinatorMetrics metrics,
                            Clock clock) {
        this.taskRepo     = taskRepo;
        this.approvalRepo = approvalRepo;
        this.props        = props;
        this.metrics      = metrics;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Enqueue a PENDING task.
     *
     * Priority is clamped into 1..10. When a dedup key is given and a live
     * (PENDING or CLAIMED) task with the same type and key exists, that task
     * is returned and nothing is inserted.
     *
     * @throws CoordinationException NOT_FOUND if the parent task or gating approval item does not exist
     */
    @Transactional
    public Task create(NewTask req) {
        if (req.type() == null || req.type().isBlank()) {
            throw new IllegalArgumentException("task type is required");
        }
        if (req.parentTaskId() != null && !taskRepo.existsById(req.parentTaskId())) {
            throw CoordinationException.notFound("parent task", req.parentTaskId());
        }
        if (req.gateApprovalId() != null && !approvalRepo.existsById(req.gateApprovalId())) {
            throw CoordinationException.notFound("approval item", req.gateApprovalId());
        }
        if (req.dedupKey() != null) {
            Optional<Task> existing = taskRepo.findFirstByTypeAndDedupKeyAndStatusIn(req.type(), req.dedupKey(), LIVE);
            if (existing.isPresent()) {
                log.info("Task '{}' with dedup key '{}' already live as {}, not enqueuing again",
                        req.type(), req.dedupKey(), existing.get().getId());
                return existing.get();
            }
        }

        Task task = new Task(req.type(), clampPriority(req.priority()), req.payloadJson());
        task.setRepoRef(req.repoRef());
        task.setParentTaskId(req.parentTaskId());
        task.setCreatedBy(req.createdBy());
        task.setTargetWorker(req.targetWorker());
        task.setDedupKey(req.dedupKey());
        task.setGateApprovalId(req.gateApprovalId());
        task.setCreatedAt(now());
        Task saved = taskRepo.save(task);
        log.info("Enqueued task {} (type={}, priority={}, by={})",
                saved.getId(), saved.getType(), saved.getPriority(), saved.getCreatedBy());
        return saved;
    }

    static int clampPriority(int priority) {
        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }

    // ------------------------------------------------------------------
    // Claiming
    // ------------------------------------------------------------------

    /**
     * Claim the best available task for this worker.
     *
     * Tasks targeted at the worker are always eligible; untargeted tasks only
     * when their type is accepted (an empty collection accepts every type).
     * A worker that loses the race for a row simply sees the next one, so
     * concurrent callers never get an error, only a different task or none.
     */
    @Transactional
    public Optional<Task> claim(String workerId, Collection<String> acceptedTypes) {
        Instant now = now();
        Optional<Task> opt = (acceptedTypes == null || acceptedTypes.isEmpty())
                ? taskRepo.lockNextClaimableAnyType(workerId, now)
                : taskRepo.lockNextClaimable(workerId, acceptedTypes, now);
        opt.ifPresent(task -> {
            task.setStatus(TaskStatus.CLAIMED);
            task.setAssignedTo(workerId);
            task.setClaimedAt(now);
            task.setHeartbeatAt(now);
            taskRepo.save(task);
            metrics.taskClaimed(task.getType());
            log.info("Worker '{}' claimed task {} (type={}, priority={}, retry={})",
                    workerId, task.getId(), task.getType(), task.getPriority(), task.getRetryCount());
        });
        return opt;
    }

    // ------------------------------------------------------------------
    // Holder operations
    // ------------------------------------------------------------------

    /**
     * Prove liveness of a claimed task.
     *
     * @throws CoordinationException NOT_OWNER when the task was reclaimed from the caller,
     *         INVALID_TRANSITION when it is no longer CLAIMED (e.g. cancelled)
     */
    @Transactional
    public void heartbeat(UUID taskId, String workerId) {
        if (taskRepo.touchIfHeld(taskId, workerId, now()) == 0) {
            throw diagnose(taskId, workerId, "heartbeat");
        }
    }

    @Transactional
    public void complete(UUID taskId, String workerId, String resultJson) {
        finish(taskId, workerId, TaskStatus.COMPLETED, resultJson, null);
    }

    @Transactional
    public void fail(UUID taskId, String workerId, String error) {
        finish(taskId, workerId, TaskStatus.FAILED, null, error);
    }

    private void finish(UUID taskId, String workerId, TaskStatus status, String resultJson, String error) {
        int updated = taskRepo.finishIfHeld(taskId, workerId, status, resultJson, error, now());
        if (updated == 0) {
            throw diagnose(taskId, workerId, status == TaskStatus.COMPLETED ? "complete" : "fail");
        }
        Task task = taskRepo.findById(taskId).orElseThrow();
        metrics.taskFinished(task.getType(), status.name());
        if (status == TaskStatus.COMPLETED) {
            log.info("Worker '{}' completed task {} (type={})", workerId, taskId, task.getType());
        } else {
            log.warn("Worker '{}' failed task {} (type={}): {}", workerId, taskId, task.getType(), error);
        }
    }

    /**
     * Hand a claimed task back to the queue without consuming a retry, for
     * example when the worker's provider became rate-limited mid-task.
     */
    @Transactional
    public void release(UUID taskId, String workerId, String reason) {
        if (taskRepo.releaseIfHeld(taskId, workerId, reason) == 0) {
            throw diagnose(taskId, workerId, "release");
        }
        log.info("Worker '{}' released task {}: {}", workerId, taskId, reason);
    }

    /**
     * Cancel a PENDING or CLAIMED task. A holder finds out on its next
     * heartbeat (INVALID_TRANSITION); nothing is interrupted here.
     */
    @Transactional
    public void cancel(UUID taskId, String reason, String cancelledBy) {
        String note = "cancelled by " + cancelledBy + (reason != null && !reason.isBlank() ? ": " + reason : "");
        if (taskRepo.cancelIfLive(taskId, note, now()) == 0) {
            Task task = taskRepo.findById(taskId)
                    .orElseThrow(() -> CoordinationException.notFound("task", taskId));
            throw CoordinationException.invalidTransition("task", taskId, task.getStatus(), "cancel");
        }
        log.info("Task {} {}", taskId, note);
    }

    /** Cancel every PENDING task gated on the given approval item. */
    @Transactional
    public int cancelGatedBy(UUID approvalId, String reason) {
        int cancelled = taskRepo.cancelGatedBy(approvalId, reason, now());
        if (cancelled > 0) {
            log.info("Cancelled {} task(s) gated on approval {}: {}", cancelled, approvalId, reason);
        }
        return cancelled;
    }

    /**
     * Figure out why a holder-conditional update touched no row.
     * Checked in order: the task is unknown, someone else (or nobody) holds
     * it, or the caller holds it but it has left CLAIMED.
     */
    private CoordinationException diagnose(UUID taskId, String workerId, String attempted) {
        Optional<Task> opt = taskRepo.findById(taskId);
        if (opt.isEmpty()) {
            return CoordinationException.notFound("task", taskId);
        }
        Task task = opt.get();
        if (!workerId.equals(task.getAssignedTo())) {
            return CoordinationException.notOwner("task", taskId, workerId, task.getAssignedTo());
        }
        return CoordinationException.invalidTransition("task", taskId, task.getStatus(), attempted);
    }

    // ------------------------------------------------------------------
    // Recovery (called by MaintenanceSweeper)
    // ------------------------------------------------------------------

    @Transactional
    public ReclaimReport reclaimStale() {
        return reclaimStale(props.getTasks().getReclaimTimeout());
    }

    /**
     * Recover tasks whose holder has gone silent.
     *
     * A CLAIMED task without a heartbeat for longer than 'timeout' goes back
     * to PENDING with retry_count + 1 and an exponential back-off, or is
     * force-failed once it has been reclaimed maxRetries times. Any worker
     * may run this; rows locked by a concurrent sweep are skipped.
     */
    @Transactional
    public ReclaimReport reclaimStale(Duration timeout) {
        Instant now = now();
        List<Task> stale = taskRepo.lockStaleClaims(now.minus(timeout));
        if (stale.isEmpty()) {
            return ReclaimReport.empty();
        }

        CoordinatorProperties.Tasks cfg = props.getTasks();
        List<UUID> reclaimed = new ArrayList<>();
        List<UUID> poisoned  = new ArrayList<>();
        for (Task task : stale) {
            String silentWorker = task.getAssignedTo();
            if (task.getRetryCount() >= cfg.getMaxRetries()) {
                task.setStatus(TaskStatus.FAILED);
                task.setAssignedTo(null);
                task.setCompletedAt(now);
                task.setError("abandoned by '" + silentWorker + "' after " + task.getRetryCount()
                        + " reclaims (no heartbeat for " + timeout + ")");
                poisoned.add(task.getId());
                log.error("Task {} (type={}) permanently failed: reclaimed {} times, last holder '{}'",
                        task.getId(), task.getType(), task.getRetryCount(), silentWorker);
            } else {
                Duration delay = backoff(task.getRetryCount(), cfg.getBackoffBase(), cfg.getBackoffCap());
                task.incrementRetryCount();
                task.setStatus(TaskStatus.PENDING);
                task.setAssignedTo(null);
                task.setClaimedAt(null);
                task.setHeartbeatAt(null);
                task.setNotBefore(now.plus(delay));
                task.setError("reclaimed from '" + silentWorker + "' (no heartbeat for " + timeout + ")");
                reclaimed.add(task.getId());
                log.warn("Reclaimed task {} from silent worker '{}' (retry {}/{}, claimable again in {})",
                        task.getId(), silentWorker, task.getRetryCount(), cfg.getMaxRetries(), delay);
            }
        }
        taskRepo.saveAll(stale);
        metrics.tasksReclaimed(reclaimed.size(), poisoned.size());
        return new ReclaimReport(reclaimed, poisoned);
    }

    /** base × 2^retries, never more than cap. */
    static Duration backoff(int retries, Duration base, Duration cap) {
        Duration delay = base.multipliedBy(1L << Math.min(retries, 20));
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    // ------------------------------------------------------------------
    // Read projections
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Task> find(UUID id) {
        return taskRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public Task get(UUID id) {
        return taskRepo.findById(id).orElseThrow(() -> CoordinationException.notFound("task", id));
    }

    @Transactional(readOnly = true)
    public List<Task> list(TaskStatus status, String type, String repoRef, int limit) {
        return taskRepo.search(status, type, repoRef, PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<Task> assignedTo(String workerId) {
        return taskRepo.findByAssignedToAndStatusOrderByClaimedAtAsc(workerId, TaskStatus.CLAIMED);
    }

    @Transactional(readOnly = true)
    public List<Task> children(UUID parentTaskId) {
        return taskRepo.findByParentTaskIdOrderByCreatedAtAsc(parentTaskId);
    }

    /** True while the task is PENDING or CLAIMED, i.e. not finished and not cancelled. */
    @Transactional(readOnly = true)
    public boolean isActionable(UUID id) {
        return taskRepo.findById(id).map(t -> LIVE.contains(t.getStatus())).orElse(false);
    }

    @Transactional(readOnly = true)
    public QueueStats stats() {
        Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
        for (TaskStatus s : TaskStatus.values()) {
            byStatus.put(s, 0L);
        }
        for (StatusCount row : taskRepo.countByStatus()) {
            byStatus.put(row.status(), row.count());
        }
        return new QueueStats(byStatus,
                toMap(taskRepo.countPendingByType()),
                toMap(taskRepo.countClaimedByWorker()));
    }

    private static Map<String, Long> toMap(List<KeyCount> rows) {
        Map<String, Long> m = new LinkedHashMap<>();
        rows.forEach(r -> m.put(r.key(), r.count()));
        return m;
    }

    private Instant now() {
        return clock.instant();
    }
}
