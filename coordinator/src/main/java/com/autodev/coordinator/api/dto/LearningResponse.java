package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.Learning;

import java.time.Instant;
import java.util.UUID;

public record LearningResponse(UUID id, String workerId, String category, String content,
                               double confidence, int validationCount,
                               Instant createdAt, Instant lastValidatedAt) {

    public static LearningResponse from(Learning l) {
        return new LearningResponse(l.getId(), l.getWorkerId(), l.getCategory(), l.getContent(),
                l.getConfidence(), l.getValidationCount(), l.getCreatedAt(), l.getLastValidatedAt());
    }
}
