package com.autodev.coordinator.memory;

/**
 * Thrown when the memory store returns an error or is unreachable.
 */
public class MemoryStoreException extends RuntimeException {

    public MemoryStoreException(String message) {
        super(message);
    }

    public MemoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
