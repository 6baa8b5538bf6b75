package com.autodev.coordinator.memory;

import java.time.Instant;
import java.util.List;

/**
 * One entry for the long-term semantic store.
 *
 * @param type       lesson | failure | partial | success
 * @param importance 1..10, used by the store to rank recall
 */
public record MemoryRecord(String type, List<String> tags, String content, int importance, Instant timestamp) {}
