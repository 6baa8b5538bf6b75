package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Self-reported state of one worker. Rows are only ever written through the
 * repository upsert; a worker that stops reporting keeps its last row.
 *
 * DB table: agent_status
 */
@Entity
@Table(name = "agent_status")
public class AgentStatus {

    @Id
    @Column(name = "worker_id")
    private String workerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AgentState state;

    @Column(name = "current_task_id")
    private UUID currentTaskId;

    @Column(name = "last_heartbeat", nullable = false)
    private Instant lastHeartbeat;

    @Column(name = "session_started_at", nullable = false)
    private Instant sessionStartedAt;

    @Column(name = "tasks_completed", nullable = false)
    private int tasksCompleted;

    protected AgentStatus() {}   // required by JPA

    public AgentStatus(String workerId, AgentState state, UUID currentTaskId, Instant lastHeartbeat) {
        this.workerId         = workerId;
        this.state            = state;
        this.currentTaskId    = currentTaskId;
        this.lastHeartbeat    = lastHeartbeat;
        this.sessionStartedAt = lastHeartbeat;
    }

    public String     getWorkerId()         { return workerId; }
    public AgentState getState()            { return state; }
    public UUID       getCurrentTaskId()    { return currentTaskId; }
    public Instant    getLastHeartbeat()    { return lastHeartbeat; }
    public Instant    getSessionStartedAt() { return sessionStartedAt; }
    public int        getTasksCompleted()   { return tasksCompleted; }
}
