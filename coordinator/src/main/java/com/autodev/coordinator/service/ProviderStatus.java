package com.autodev.coordinator.service;

import java.time.Instant;

/**
 * Point-in-time view of a provider. 'limited' is already evaluated against
 * the clock: a stored limit whose reset time has passed reads as available.
 */
public record ProviderStatus(String provider, boolean limited, Instant resetAt, String setBy, Instant updatedAt) {

    public static ProviderStatus available(String provider) {
        return new ProviderStatus(provider, false, null, null, null);
    }
}
