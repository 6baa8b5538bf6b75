package com.autodev.coordinator.service;

import java.time.Instant;

/** Every candidate provider is currently rate-limited. */
public class NoProviderAvailableException extends CoordinationException {

    private final Instant earliestReset;

    public NoProviderAvailableException(Instant earliestReset) {
        super(Kind.NO_PROVIDER_AVAILABLE,
                "all providers are rate-limited" + (earliestReset != null ? " until " + earliestReset : ""));
        this.earliestReset = earliestReset;
    }

    /** Soonest instant at which one of the providers is expected back; null if unknown. */
    public Instant getEarliestReset() { return earliestReset; }
}
