package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.ProviderHealth;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ProviderHealthRepository extends JpaRepository<ProviderHealth, String> {

    /** Single current row per provider; the last writer wins. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            INSERT INTO provider_health (provider, limited, reset_at, set_by, updated_at)
            VALUES (:provider, :limited, :resetAt, :setBy, :now)
            ON CONFLICT (provider) DO UPDATE
               SET limited    = EXCLUDED.limited,
                   reset_at   = EXCLUDED.reset_at,
                   set_by     = EXCLUDED.set_by,
                   updated_at = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsert(@Param("provider") String provider,
               @Param("limited") boolean limited,
               @Param("resetAt") Instant resetAt,
               @Param("setBy") String setBy,
               @Param("now") Instant now);

    List<ProviderHealth> findAllByOrderByProviderAsc();
}
