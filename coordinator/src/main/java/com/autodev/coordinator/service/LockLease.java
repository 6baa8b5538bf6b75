package com.autodev.coordinator.service;

import java.time.Duration;
import java.time.Instant;

/**
 * A held lease, released by close(). Use with try-with-resources so the
 * lease goes away on every exit path; call renew() while long work continues.
 */
public final class LockLease implements AutoCloseable {

    private final LockService locks;
    private final String      resourceKey;
    private final String      holder;
    private final Duration    ttl;

    private volatile Instant expiresAt;
    private volatile boolean released;

    LockLease(LockService locks, String resourceKey, String holder, Duration ttl, Instant expiresAt) {
        this.locks       = locks;
        this.resourceKey = resourceKey;
        this.holder      = holder;
        this.ttl         = ttl;
        this.expiresAt   = expiresAt;
    }

    public String  getResourceKey() { return resourceKey; }
    public String  getHolder()      { return holder; }
    public Instant getExpiresAt()   { return expiresAt; }
    public boolean isReleased()     { return released; }

    /**
     * Extend the lease by the original TTL from now.
     *
     * @throws CoordinationException NOT_OWNER if the lease already expired and was lost
     */
    public void renew() {
        expiresAt = locks.renew(resourceKey, holder, ttl).getExpiresAt();
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            locks.release(resourceKey, holder);
        }
    }
}
