package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.Learning;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface LearningRepository extends JpaRepository<Learning, UUID> {

    /** Atomic increment; content is never touched. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Learning l
               SET l.validationCount = l.validationCount + 1, l.lastValidatedAt = :now
             WHERE l.id = :id
            """)
    int incrementValidation(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Learnings worth feeding to a worker: its own plus the shared "general"
     * pool, most corroborated first.
     */
    @Query("""
            SELECT l FROM Learning l
            WHERE l.workerId = :workerId OR l.workerId = :sharedPool
            ORDER BY l.validationCount DESC, l.confidence DESC, l.createdAt DESC
            """)
    List<Learning> findRelevant(@Param("workerId") String workerId,
                                @Param("sharedPool") String sharedPool,
                                Pageable page);

    List<Learning> findAllByOrderByValidationCountDescCreatedAtDesc(Pageable page);
}
