package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * The single current rate-limit record for one external reasoning provider.
 * The limited flag is only meaningful together with reset_at: once the reset
 * time has passed the provider is available again without anyone writing.
 *
 * DB table: provider_health
 */
@Entity
@Table(name = "provider_health")
public class ProviderHealth {

    @Id
    private String provider;

    @Column(nullable = false)
    private boolean limited;

    @Column(name = "reset_at")
    private Instant resetAt;

    @Column(name = "set_by")
    private String setBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ProviderHealth() {}   // required by JPA

    public ProviderHealth(String provider, boolean limited, Instant resetAt, String setBy, Instant updatedAt) {
        this.provider  = provider;
        this.limited   = limited;
        this.resetAt   = resetAt;
        this.setBy     = setBy;
        this.updatedAt = updatedAt;
    }

    public String  getProvider()  { return provider; }
    public boolean isLimited()    { return limited; }
    public Instant getResetAt()   { return resetAt; }
    public String  getSetBy()     { return setBy; }
    public Instant getUpdatedAt() { return updatedAt; }

    /** Limited right now: the stored flag alone is not trusted past reset_at. */
    public boolean isLimitedAt(Instant now) {
        return limited && resetAt != null && now.isBefore(resetAt);
    }
}
