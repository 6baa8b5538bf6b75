package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.ResourceLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Lease table queries. acquire is a single INSERT ... ON CONFLICT statement
 * so that two workers racing for the same key can never both succeed.
 *
 * The writes are @Transactional themselves: LockLease acquires and releases
 * outside any service transaction, and a lease must never span the guarded work.
 */
public interface ResourceLockRepository extends JpaRepository<ResourceLock, String> {

    /**
     * Insert the lease, or take over the existing row if it has expired or is
     * already ours (refresh). Returns 1 on success, 0 when someone else holds
     * an unexpired lease.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            INSERT INTO resource_locks (resource_key, holder, acquired_at, expires_at)
            VALUES (:key, :holder, :now, :expiresAt)
            ON CONFLICT (resource_key) DO UPDATE
               SET holder      = EXCLUDED.holder,
                   acquired_at = CASE
                                   WHEN resource_locks.holder = EXCLUDED.holder
                                    AND resource_locks.expires_at > EXCLUDED.acquired_at
                                   THEN resource_locks.acquired_at
                                   ELSE EXCLUDED.acquired_at
                                 END,
                   expires_at  = EXCLUDED.expires_at
             WHERE resource_locks.expires_at <= EXCLUDED.acquired_at
                OR resource_locks.holder = EXCLUDED.holder
            """, nativeQuery = true)
    int acquireIfFree(@Param("key") String key,
                      @Param("holder") String holder,
                      @Param("now") Instant now,
                      @Param("expiresAt") Instant expiresAt);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ResourceLock l SET l.expiresAt = :expiresAt
            WHERE l.resourceKey = :key AND l.holder = :holder AND l.expiresAt > :now
            """)
    int renewIfHeld(@Param("key") String key,
                    @Param("holder") String holder,
                    @Param("now") Instant now,
                    @Param("expiresAt") Instant expiresAt);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ResourceLock l WHERE l.resourceKey = :key AND l.holder = :holder")
    int deleteIfHeld(@Param("key") String key, @Param("holder") String holder);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ResourceLock l WHERE l.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    List<ResourceLock> findByExpiresAtAfterOrderByResourceKeyAsc(Instant now);

    List<ResourceLock> findByHolderAndExpiresAtAfterOrderByResourceKeyAsc(String holder, Instant now);
}
