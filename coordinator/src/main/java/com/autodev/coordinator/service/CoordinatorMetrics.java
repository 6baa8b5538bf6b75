package com.autodev.coordinator.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for coordination events. Exposed through the actuator
 * endpoint alongside the JVM and datasource metrics.
 */
@Component
public class CoordinatorMetrics {

    private final MeterRegistry registry;

    public CoordinatorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void taskClaimed(String taskType) {
        Counter.builder("autodev.tasks.claimed")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    public void taskFinished(String taskType, String status) {
        Counter.builder("autodev.tasks.finished")
                .tag("type", taskType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void tasksReclaimed(int reclaimed, int poisoned) {
        Counter.builder("autodev.tasks.reclaimed").register(registry).increment(reclaimed);
        Counter.builder("autodev.tasks.poisoned").register(registry).increment(poisoned);
    }

    public void lockConflict() {
        Counter.builder("autodev.locks.conflicts").register(registry).increment();
    }

    public void voteCast(String stance) {
        Counter.builder("autodev.proposals.votes")
                .tag("stance", stance)
                .register(registry)
                .increment();
    }

    public void approvalDecided(String itemType, String decision) {
        Counter.builder("autodev.approvals.decisions")
                .tag("type", itemType)
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void outcomeRecorded(String outcome) {
        Counter.builder("autodev.outcomes.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void rateLimitReported(String provider) {
        Counter.builder("autodev.providers.rate_limits")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }
}
