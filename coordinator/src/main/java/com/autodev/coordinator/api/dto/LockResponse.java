package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.ResourceLock;

import java.time.Instant;

public record LockResponse(String resourceKey, String holder, Instant acquiredAt, Instant expiresAt) {

    public static LockResponse from(ResourceLock l) {
        return new LockResponse(l.getResourceKey(), l.getHolder(), l.getAcquiredAt(), l.getExpiresAt());
    }
}
