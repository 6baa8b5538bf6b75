package com.autodev.coordinator.service;

import java.util.List;
import java.util.UUID;

/** Result of one stale-claim sweep. */
public record ReclaimReport(List<UUID> reclaimed, List<UUID> poisoned) {

    public static ReclaimReport empty() {
        return new ReclaimReport(List.of(), List.of());
    }

    public boolean isEmpty() {
        return reclaimed.isEmpty() && poisoned.isEmpty();
    }
}
