package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable result of one task execution. Every column is non-updatable.
 *
 * DB table: outcome_records
 */
@Entity
@Table(name = "outcome_records")
public class OutcomeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private String workerId;

    @Column(name = "task_type", nullable = false, updatable = false)
    private String taskType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Outcome outcome;

    @Column(name = "duration_ms", updatable = false)
    private Long durationMs;

    @Column(name = "error_summary", updatable = false, columnDefinition = "TEXT")
    private String errorSummary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected OutcomeRecord() {}   // required by JPA

    public OutcomeRecord(UUID taskId, String workerId, String taskType, Outcome outcome,
                         Long durationMs, String errorSummary) {
        this.taskId       = taskId;
        this.workerId     = workerId;
        this.taskType     = taskType;
        this.outcome      = outcome;
        this.durationMs   = durationMs;
        this.errorSummary = errorSummary;
    }

    public UUID    getId()           { return id; }
    public UUID    getTaskId()       { return taskId; }
    public String  getWorkerId()     { return workerId; }
    public String  getTaskType()     { return taskType; }
    public Outcome getOutcome()      { return outcome; }
    public Long    getDurationMs()   { return durationMs; }
    public String  getErrorSummary() { return errorSummary; }
    public Instant getCreatedAt()    { return createdAt; }

    public void setCreatedAt(Instant t) { this.createdAt = t; }
}
