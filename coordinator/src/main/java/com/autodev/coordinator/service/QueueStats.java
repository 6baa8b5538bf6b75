package com.autodev.coordinator.service;

import com.autodev.coordinator.model.TaskStatus;

import java.util.Map;

/** Backlog snapshot for the dashboard. */
public record QueueStats(Map<TaskStatus, Long> byStatus,
                         Map<String, Long> pendingByType,
                         Map<String, Long> claimedByWorker) {

    public long total() {
        return byStatus.values().stream().mapToLong(Long::longValue).sum();
    }
}
