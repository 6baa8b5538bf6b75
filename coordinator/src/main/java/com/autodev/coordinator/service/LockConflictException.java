package com.autodev.coordinator.service;

import java.time.Instant;

/** Another worker holds an unexpired lease on the resource. */
public class LockConflictException extends CoordinationException {

    private final String  resourceKey;
    private final String  holder;
    private final Instant expiresAt;

    public LockConflictException(String resourceKey, String holder, Instant expiresAt) {
        super(Kind.LOCK_CONFLICT,
                "'" + resourceKey + "' is held by '" + holder + "' until " + expiresAt);
        this.resourceKey = resourceKey;
        this.holder      = holder;
        this.expiresAt   = expiresAt;
    }

    public String  getResourceKey() { return resourceKey; }
    public String  getHolder()      { return holder; }
    public Instant getExpiresAt()   { return expiresAt; }
}
