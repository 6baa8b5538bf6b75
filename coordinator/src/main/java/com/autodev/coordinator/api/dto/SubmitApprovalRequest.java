package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.ApprovalType;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for POST /approvals.
 *
 * reference is the id of the task the item gates, or an external pointer.
 * followOnType overrides the task type enqueued on approval.
 */
public record SubmitApprovalRequest(@NotNull  ApprovalType itemType,
                                    @NotBlank String reference,
                                    @NotBlank String submittedBy,
                                    String   title,
                                    JsonNode context,
                                    String   followOnType) {}
