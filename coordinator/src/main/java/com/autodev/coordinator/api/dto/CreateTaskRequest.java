package com.autodev.coordinator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

import java.util.UUID;

/**
 * Request body for POST /tasks.
 *
 * Required: type
 * Optional: everything else. priority defaults to 5 and is clamped into 1..10;
 *   payload is any JSON value and is stored verbatim.
 */
public record CreateTaskRequest(@NotBlank String type,
                                Integer  priority,
                                JsonNode payload,
                                String   repoRef,
                                UUID     parentTaskId,
                                String   createdBy,
                                String   targetWorker,
                                String   dedupKey,
                                UUID     gateApprovalId) {

    // Compact constructor: dashboard submissions are attributed to "human" unless stated.
    public CreateTaskRequest {
        if (createdBy == null || createdBy.isBlank()) createdBy = "human";
    }
}
