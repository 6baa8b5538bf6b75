package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.ApprovalItem;
import com.autodev.coordinator.model.ApprovalStatus;
import com.autodev.coordinator.model.ApprovalType;

import java.time.Instant;
import java.util.UUID;

public record ApprovalResponse(
        UUID           id,
        ApprovalType   itemType,
        String         reference,
        String         title,
        String         contextJson,
        String         followOnType,
        String         submittedBy,
        ApprovalStatus status,
        String         reviewer,
        String         reviewerNotes,
        Instant        createdAt,
        Instant        resolvedAt
) {
    public static ApprovalResponse from(ApprovalItem a) {
        return new ApprovalResponse(
                a.getId(),
                a.getItemType(),
                a.getReference(),
                a.getTitle(),
                a.getContextJson(),
                a.getFollowOnType(),
                a.getSubmittedBy(),
                a.getStatus(),
                a.getReviewer(),
                a.getReviewerNotes(),
                a.getCreatedAt(),
                a.getResolvedAt()
        );
    }
}
