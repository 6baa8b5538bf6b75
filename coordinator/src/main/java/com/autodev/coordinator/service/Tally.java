package com.autodev.coordinator.service;

/** Vote counts of one proposal. */
public record Tally(long votesFor, long votesAgainst) {

    public long total() {
        return votesFor + votesAgainst;
    }

    /** Fraction of votes in favour; 0 when nobody has voted. */
    public double approvalRate() {
        return total() == 0 ? 0.0 : (double) votesFor / total();
    }
}
