package com.autodev.coordinator.model;

/**
 * OPEN until a resolver persists APPROVED or REJECTED. REJECTED is terminal;
 * an APPROVED proposal moves to IMPLEMENTED once the change has been made.
 */
public enum ProposalStatus {
    OPEN,
    APPROVED,
    REJECTED,
    IMPLEMENTED
}
