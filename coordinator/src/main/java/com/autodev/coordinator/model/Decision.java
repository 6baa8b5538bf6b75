package com.autodev.coordinator.model;

/**
 * Result of evaluating a proposal's vote set.
 * UNDECIDED is never persisted; the proposal simply stays OPEN.
 */
public enum Decision {
    APPROVED,
    REJECTED,
    UNDECIDED;

    public boolean isFinal() {
        return this != UNDECIDED;
    }

    public ProposalStatus toStatus() {
        return switch (this) {
            case APPROVED  -> ProposalStatus.APPROVED;
            case REJECTED  -> ProposalStatus.REJECTED;
            case UNDECIDED -> ProposalStatus.OPEN;
        };
    }

    public static Decision fromStatus(ProposalStatus status) {
        return switch (status) {
            case APPROVED, IMPLEMENTED -> APPROVED;
            case REJECTED -> REJECTED;
            case OPEN     -> UNDECIDED;
        };
    }
}
