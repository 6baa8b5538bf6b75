package com.autodev.coordinator.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when no memory store is configured: records are only logged. */
public class LoggingMemorySink implements MemorySink {

    private static final Logger log = LoggerFactory.getLogger(LoggingMemorySink.class);

    @Override
    public void store(MemoryRecord record) {
        log.debug("Memory store disabled, dropping {} record (importance={}, tags={})",
                record.type(), record.importance(), record.tags());
    }
}
