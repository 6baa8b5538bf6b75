package com.autodev.coordinator.service;

import com.autodev.coordinator.model.Outcome;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Ledger rollup over the window starting at 'since'. */
public record OutcomeStats(Instant since,
                           Map<Outcome, Long> totals,
                           List<OutcomeRollup> byWorker,
                           List<OutcomeRollup> byTaskType) {

    public long total() {
        return totals.values().stream().mapToLong(Long::longValue).sum();
    }
}
