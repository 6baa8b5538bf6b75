package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A time-bounded advisory lease over a named resource (usually a file path
 * scoped to a repository). A row whose expires_at has passed is inert and
 * may be taken over or purged by any worker.
 *
 * DB table: resource_locks
 */
@Entity
@Table(name = "resource_locks")
public class ResourceLock {

    @Id
    @Column(name = "resource_key")
    private String resourceKey;

    @Column(nullable = false)
    private String holder;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected ResourceLock() {}   // required by JPA

    public ResourceLock(String resourceKey, String holder, Instant acquiredAt, Instant expiresAt) {
        this.resourceKey = resourceKey;
        this.holder      = holder;
        this.acquiredAt  = acquiredAt;
        this.expiresAt   = expiresAt;
    }

    public String  getResourceKey() { return resourceKey; }
    public String  getHolder()      { return holder; }
    public Instant getAcquiredAt()  { return acquiredAt; }
    public Instant getExpiresAt()   { return expiresAt; }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
