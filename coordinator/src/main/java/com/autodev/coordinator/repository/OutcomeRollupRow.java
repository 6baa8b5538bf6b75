package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.Outcome;

/** One (key, outcome) group of the outcome ledger rollup. */
public record OutcomeRollupRow(String key, Outcome outcome, Long count, Double avgDurationMs) {}
