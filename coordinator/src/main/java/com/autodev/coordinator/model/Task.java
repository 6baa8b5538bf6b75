package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of work in the shared backlog.
 *
 * Workers claim a PENDING task via SELECT FOR UPDATE SKIP LOCKED, set
 * status = CLAIMED and assigned_to, then heartbeat until they report a
 * terminal state. payload_json and result_json are opaque to the core.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Routing tag, e.g. "implement_feature" or "write_spec".
    @Column(nullable = false)
    private String type;

    // 1..10, higher is claimed sooner.
    @Column(nullable = false)
    private int priority = 5;

    @Column(name = "payload_json", columnDefinition = "TEXT")
    private String payloadJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.PENDING;

    // Current claim holder. Cleared when the task is reclaimed or released.
    @Column(name = "assigned_to")
    private String assignedTo;

    // When set, only this worker may claim the task, whatever its accepted types.
    @Column(name = "target_worker")
    private String targetWorker;

    @Column(name = "repo_ref")
    private String repoRef;

    @Column(name = "parent_task_id")
    private UUID parentTaskId;

    // Claimable only once this approval item is APPROVED.
    @Column(name = "gate_approval_id")
    private UUID gateApprovalId;

    @Column(name = "dedup_key")
    private String dedupKey;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(columnDefinition = "TEXT")
    private String error;

    // Number of times this task was reclaimed from a silent worker.
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    // Back-off after a reclaim: not claimable before this instant.
    @Column(name = "not_before")
    private Instant notBefore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "claimed_at")
    private Instant claimedAt;

    // Touched by the holder to prove liveness; reclaim compares against it.
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String type, int priority, String payloadJson) {
        this.type        = type;
        this.priority    = priority;
        this.payloadJson = payloadJson;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()             { return id; }
    public String     getType()           { return type; }
    public int        getPriority()       { return priority; }
    public String     getPayloadJson()    { return payloadJson; }
    public TaskStatus getStatus()         { return status; }
    public String     getAssignedTo()     { return assignedTo; }
    public String     getTargetWorker()   { return targetWorker; }
    public String     getRepoRef()        { return repoRef; }
    public UUID       getParentTaskId()   { return parentTaskId; }
    public UUID       getGateApprovalId() { return gateApprovalId; }
    public String     getDedupKey()       { return dedupKey; }
    public String     getCreatedBy()      { return createdBy; }
    public String     getResultJson()     { return resultJson; }
    public String     getError()          { return error; }
    public int        getRetryCount()     { return retryCount; }
    public Instant    getNotBefore()      { return notBefore; }
    public Instant    getCreatedAt()      { return createdAt; }
    public Instant    getClaimedAt()      { return claimedAt; }
    public Instant    getHeartbeatAt()    { return heartbeatAt; }
    public Instant    getCompletedAt()    { return completedAt; }

    public void setStatus(TaskStatus status)         { this.status = status; }
    public void setAssignedTo(String assignedTo)     { this.assignedTo = assignedTo; }
    public void setTargetWorker(String targetWorker) { this.targetWorker = targetWorker; }
    public void setRepoRef(String repoRef)           { this.repoRef = repoRef; }
    public void setParentTaskId(UUID parentTaskId)   { this.parentTaskId = parentTaskId; }
    public void setGateApprovalId(UUID id)           { this.gateApprovalId = id; }
    public void setDedupKey(String dedupKey)         { this.dedupKey = dedupKey; }
    public void setCreatedBy(String createdBy)       { this.createdBy = createdBy; }
    public void setResultJson(String resultJson)     { this.resultJson = resultJson; }
    public void setError(String error)               { this.error = error; }
    public void setNotBefore(Instant t)              { this.notBefore = t; }
    public void setCreatedAt(Instant t)              { this.createdAt = t; }
    public void setClaimedAt(Instant t)              { this.claimedAt = t; }
    public void setHeartbeatAt(Instant t)            { this.heartbeatAt = t; }
    public void setCompletedAt(Instant t)            { this.completedAt = t; }
    public void incrementRetryCount()                { this.retryCount++; }
}
