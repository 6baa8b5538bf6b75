package com.autodev.coordinator.service;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.ResourceLock;
import com.autodev.coordinator.repository.ResourceLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Time-bounded exclusive leases on named resources (files, branches).
 *
 * A lease whose expiry has passed is free even if its row is still there;
 * expired rows are taken over by acquire() and swept by purgeExpired().
 */
@Service
public class LockService {

    private static final Logger log = LoggerFactory.getLogger(LockService.class);

    private final ResourceLockRepository lockRepo;
    private final CoordinatorProperties  props;
    private final CoordinatorMetrics     metrics;
    private final Clock                  clock;

    public LockService(ResourceLockRepository lockRepo,
                       CoordinatorProperties props,
                       CoordinatorMetrics metrics,
                       Clock clock) {
        this.lockRepo = lockRepo;
        this.props    = props;
        this.metrics  = metrics;
        this.clock    = clock;
    }

    // ------------------------------------------------------------------
    // Acquire / release
    // ------------------------------------------------------------------

    /**
     * Take the lease, or refresh it if the caller already holds it.
     *
     * @throws LockConflictException if another holder has an unexpired lease
     */
    @Transactional
    public ResourceLock acquire(String resourceKey, String holder, Duration ttl) {
        return tryAcquire(resourceKey, holder, ttl).orElseThrow(() -> {
            Optional<ResourceLock> current = lockRepo.findById(resourceKey);
            metrics.lockConflict();
            log.warn("'{}' could not lock '{}': held by '{}' until {}", holder, resourceKey,
                    current.map(ResourceLock::getHolder).orElse(null),
                    current.map(ResourceLock::getExpiresAt).orElse(null));
            return new LockConflictException(resourceKey,
                    current.map(ResourceLock::getHolder).orElse(null),
                    current.map(ResourceLock::getExpiresAt).orElse(null));
        });
    }

    public ResourceLock acquire(String resourceKey, String holder) {
        return acquire(resourceKey, holder, props.getLocks().getDefaultTtl());
    }

    /** Like acquire() but reports a conflict as empty instead of throwing. */
    @Transactional
    public Optional<ResourceLock> tryAcquire(String resourceKey, String holder, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("lock ttl must be positive, got " + ttl);
        }
        Instant now = now();
        if (lockRepo.acquireIfFree(resourceKey, holder, now, now.plus(ttl)) == 0) {
            return Optional.empty();
        }
        log.debug("'{}' locked '{}' for {}", holder, resourceKey, ttl);
        return lockRepo.findById(resourceKey);
    }

    /**
     * Drop the caller's lease. Releasing a lease that is not held (or held by
     * someone else) changes nothing.
     *
     * @return true if a lease was actually removed
     */
    @Transactional
    public boolean release(String resourceKey, String holder) {
        boolean released = lockRepo.deleteIfHeld(resourceKey, holder) > 0;
        if (released) {
            log.debug("'{}' released '{}'", holder, resourceKey);
        }
        return released;
    }

    /**
     * Push the expiry of a lease the caller still holds.
     *
     * @throws CoordinationException NOT_FOUND if no lease exists, NOT_OWNER if it
     *         belongs to someone else or has already expired
     */
    @Transactional
    public ResourceLock renew(String resourceKey, String holder, Duration ttl) {
        Instant now = now();
        if (lockRepo.renewIfHeld(resourceKey, holder, now, now.plus(ttl)) == 0) {
            ResourceLock current = lockRepo.findById(resourceKey)
                    .orElseThrow(() -> CoordinationException.notFound("lock", resourceKey));
            throw current.getHolder().equals(holder)
                    ? new CoordinationException(CoordinationException.Kind.NOT_OWNER,
                            "lock " + resourceKey + " expired at " + current.getExpiresAt())
                    : CoordinationException.notOwner("lock", resourceKey, holder, current.getHolder());
        }
        return lockRepo.findById(resourceKey).orElseThrow();
    }

    /** Remove every expired lease row. Safe to run from any worker. */
    @Transactional
    public int purgeExpired() {
        int purged = lockRepo.deleteExpired(now());
        if (purged > 0) {
            log.info("Purged {} expired lock(s)", purged);
        }
        return purged;
    }

    // ------------------------------------------------------------------
    // Scoped acquisition
    // ------------------------------------------------------------------

    /** Acquire and wrap in a lease that releases on close(). */
    public LockLease open(String resourceKey, String holder, Duration ttl) {
        ResourceLock lock = acquire(resourceKey, holder, ttl);
        return new LockLease(this, resourceKey, holder, ttl, lock.getExpiresAt());
    }

    /**
     * Run work while holding the lease; it is released however work ends.
     * No transaction is held open around the work itself.
     */
    public <T> T withLock(String resourceKey, String holder, Duration ttl, Callable<T> work) throws Exception {
        try (LockLease lease = open(resourceKey, holder, ttl)) {
            return work.call();
        }
    }

    // ------------------------------------------------------------------
    // Read projections
    // ------------------------------------------------------------------

    /** Unexpired leases, optionally only those of one holder. */
    @Transactional(readOnly = true)
    public List<ResourceLock> active(String holder) {
        Instant now = now();
        return holder == null
                ? lockRepo.findByExpiresAtAfterOrderByResourceKeyAsc(now)
                : lockRepo.findByHolderAndExpiresAtAfterOrderByResourceKeyAsc(holder, now);
    }

    /** The current unexpired lease on a key, if any. */
    @Transactional(readOnly = true)
    public Optional<ResourceLock> holderOf(String resourceKey) {
        Instant now = now();
        return lockRepo.findById(resourceKey).filter(l -> !l.isExpiredAt(now));
    }

    private Instant now() {
        return clock.instant();
    }
}
