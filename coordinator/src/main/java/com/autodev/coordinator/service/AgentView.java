package com.autodev.coordinator.service;

import com.autodev.coordinator.model.AgentState;

import java.time.Instant;
import java.util.UUID;

/**
 * A worker's last report. 'stale' is evaluated against the clock: a worker
 * that claims to be up but has not reported within the reclaim timeout is
 * most likely gone.
 */
public record AgentView(String     workerId,
                        AgentState state,
                        boolean    stale,
                        UUID       currentTaskId,
                        Instant    lastHeartbeat,
                        Instant    sessionStartedAt,
                        int        tasksCompleted) {}
