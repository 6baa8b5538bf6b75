package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.ApprovalStatus;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for POST /approvals/{id}/decision.
 * decision is APPROVED or REJECTED; notes become the rejection reason.
 */
public record DecisionRequest(@NotNull ApprovalStatus decision, String notes, String reviewer) {

    public DecisionRequest {
        if (reviewer == null || reviewer.isBlank()) reviewer = "human";
    }
}
