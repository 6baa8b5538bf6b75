package com.autodev.coordinator.service;

import com.autodev.coordinator.model.Decision;

/**
 * Quorum/threshold evaluation of a vote set. Pure: no I/O, no clock.
 *
 * Fewer than 'quorum' votes is UNDECIDED whatever the split. Otherwise the
 * proposal is APPROVED when for / (for + against) reaches 'threshold' and
 * REJECTED when it does not.
 */
public final class ConsensusRule {

    // Absorbs binary rounding, so 3/5 meets a 0.6 threshold.
    private static final double EPSILON = 1e-9;

    private ConsensusRule() {}

    public static Decision evaluate(Tally tally, int quorum, double threshold) {
        if (quorum < 1) {
            throw new IllegalArgumentException("quorum must be at least 1, got " + quorum);
        }
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1], got " + threshold);
        }
        if (tally.total() < quorum) {
            return Decision.UNDECIDED;
        }
        return tally.approvalRate() + EPSILON >= threshold ? Decision.APPROVED : Decision.REJECTED;
    }
}
