package com.autodev.coordinator.service;

/** Outcome counts and mean duration for one worker or one task type. */
public record OutcomeRollup(String key, long success, long failure, long partial, Double avgDurationMs) {

    public long total() {
        return success + failure + partial;
    }

    /** Successes over all outcomes; 0 when there are none. */
    public double successRate() {
        return total() == 0 ? 0.0 : (double) success / total();
    }
}
