package com.autodev.coordinator.model;

/**
 * PENDING → APPROVED or PENDING → REJECTED. Both are terminal.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
