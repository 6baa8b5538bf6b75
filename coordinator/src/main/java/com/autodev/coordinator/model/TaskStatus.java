package com.autodev.coordinator.model;

/**
 * Lifecycle of a queued Task.
 *
 * Transitions:
 *   PENDING → CLAIMED    (atomic claim by exactly one worker)
 *   CLAIMED → COMPLETED  (holder reports success)
 *   CLAIMED → FAILED     (holder reports failure, or poison-task protection)
 *   CLAIMED → PENDING    (stale reclaim or voluntary release)
 *   PENDING/CLAIMED → CANCELLED
 */
public enum TaskStatus {
    PENDING,
    CLAIMED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
