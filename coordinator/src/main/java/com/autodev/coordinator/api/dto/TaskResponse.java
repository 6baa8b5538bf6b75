package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a task. payloadJson and resultJson are returned as the
 * stored JSON text.
 */
public record TaskResponse(
        UUID       id,
        String     type,
        int        priority,
        TaskStatus status,
        String     assignedTo,
        String     targetWorker,
        String     repoRef,
        UUID       parentTaskId,
        UUID       gateApprovalId,
        String     createdBy,
        int        retryCount,
        String     payloadJson,
        String     resultJson,
        String     error,
        Instant    notBefore,
        Instant    createdAt,
        Instant    claimedAt,
        Instant    heartbeatAt,
        Instant    completedAt
) {
    public static TaskResponse from(Task t) {
        return new TaskResponse(
                t.getId(),
                t.getType(),
                t.getPriority(),
                t.getStatus(),
                t.getAssignedTo(),
                t.getTargetWorker(),
                t.getRepoRef(),
                t.getParentTaskId(),
                t.getGateApprovalId(),
                t.getCreatedBy(),
                t.getRetryCount(),
                t.getPayloadJson(),
                t.getResultJson(),
                t.getError(),
                t.getNotBefore(),
                t.getCreatedAt(),
                t.getClaimedAt(),
                t.getHeartbeatAt(),
                t.getCompletedAt()
        );
    }
}
