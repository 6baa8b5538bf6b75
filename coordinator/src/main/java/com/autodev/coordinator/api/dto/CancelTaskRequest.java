package com.autodev.coordinator.api.dto;

/** Request body for POST /tasks/{id}/cancel. Both fields optional. */
public record CancelTaskRequest(String reason, String cancelledBy) {

    public CancelTaskRequest {
        if (cancelledBy == null || cancelledBy.isBlank()) cancelledBy = "human";
    }
}
