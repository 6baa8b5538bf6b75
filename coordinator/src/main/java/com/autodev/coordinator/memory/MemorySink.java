package com.autodev.coordinator.memory;

/**
 * Hand-off point to the external long-term memory store. Writes are
 * best-effort: implementations may throw {@link MemoryStoreException},
 * and callers log it without undoing their own work.
 */
public interface MemorySink {

    void store(MemoryRecord record);
}
