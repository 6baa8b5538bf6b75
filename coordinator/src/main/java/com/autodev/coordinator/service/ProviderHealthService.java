package com.autodev.coordinator.service;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.ProviderHealth;
import com.autodev.coordinator.repository.ProviderHealthRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Shared view of which LLM providers are rate-limited and until when.
 *
 * One row per provider, last writer wins. Reads are never cached: a worker
 * must see another worker's report on its very next call.
 */
@Service
public class ProviderHealthService {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthService.class);

    private final ProviderHealthRepository healthRepo;
    private final CoordinatorProperties    props;
    private final CoordinatorMetrics       metrics;
    private final Clock                    clock;

    public ProviderHealthService(ProviderHealthRepository healthRepo,
                                 CoordinatorProperties props,
                                 CoordinatorMetrics metrics,
                                 Clock clock) {
        this.healthRepo = healthRepo;
        this.props      = props;
        this.metrics    = metrics;
        this.clock      = clock;
    }

    /**
     * Record that a provider is limited until resetAt (null: now plus the
     * configured default limit duration).
     */
    @Transactional
    public ProviderStatus reportLimited(String provider, Instant resetAt, String setBy) {
        Instant now = clock.instant();
        Instant reset = resetAt != null ? resetAt : now.plus(props.getProviders().getDefaultLimitDuration());
        healthRepo.upsert(provider, true, reset, setBy, now);
        metrics.rateLimitReported(provider);
        log.warn("Provider '{}' rate-limited until {} (reported by '{}')", provider, reset, setBy);
        return new ProviderStatus(provider, reset.isAfter(now), reset, setBy, now);
    }

    @Transactional
    public ProviderStatus clear(String provider, String setBy) {
        Instant now = clock.instant();
        healthRepo.upsert(provider, false, null, setBy, now);
        log.info("Provider '{}' limit cleared by '{}'", provider, setBy);
        return new ProviderStatus(provider, false, null, setBy, now);
    }

    @Transactional(readOnly = true)
    public ProviderStatus current(String provider) {
        Instant now = clock.instant();
        return healthRepo.findById(provider)
                .map(h -> toStatus(h, now))
                .orElseGet(() -> ProviderStatus.available(provider));
    }

    @Transactional(readOnly = true)
    public List<ProviderStatus> all() {
        Instant now = clock.instant();
        return healthRepo.findAllByOrderByProviderAsc().stream()
                .map(h -> toStatus(h, now))
                .toList();
    }

    /**
     * The preferred provider if it is available, else the fallback.
     *
     * @throws NoProviderAvailableException when both are limited, carrying the earlier reset
     */
    @Transactional(readOnly = true)
    public String selectProvider(String preferred, String fallback) {
        ProviderStatus first = current(preferred);
        if (!first.limited()) {
            return preferred;
        }
        if (fallback == null || fallback.equals(preferred)) {
            throw new NoProviderAvailableException(first.resetAt());
        }
        ProviderStatus second = current(fallback);
        if (!second.limited()) {
            log.info("Provider '{}' limited until {}, falling back to '{}'", preferred, first.resetAt(), fallback);
            return fallback;
        }
        Instant earliest = Stream.of(first.resetAt(), second.resetAt())
                .filter(t -> t != null)
                .min(Instant::compareTo)
                .orElse(null);
        throw new NoProviderAvailableException(earliest);
    }

    /**
     * Provider a worker should use for its next task: the manual override if
     * set, else the worker's own override, else the default provider with a
     * fall back to the secondary when auto-fallback is on.
     *
     * @throws NoProviderAvailableException when the default and the fallback are both limited
     */
    @Transactional(readOnly = true)
    public String recommendFor(String workerId) {
        CoordinatorProperties.Providers cfg = props.getProviders();
        if (cfg.getManualOverride() != null && !cfg.getManualOverride().isBlank()) {
            return cfg.getManualOverride().trim().toLowerCase(Locale.ROOT);
        }
        String workerOverride = cfg.getWorkerOverrides().get(workerId);
        if (workerOverride != null && !workerOverride.isBlank()) {
            return workerOverride.trim().toLowerCase(Locale.ROOT);
        }
        if (!cfg.isAutoFallback()) {
            return cfg.getDefaultProvider();
        }
        return selectProvider(cfg.getDefaultProvider(), cfg.getFallbackProvider());
    }

    private static ProviderStatus toStatus(ProviderHealth h, Instant now) {
        return new ProviderStatus(h.getProvider(), h.isLimitedAt(now), h.getResetAt(), h.getSetBy(), h.getUpdatedAt());
    }
}
