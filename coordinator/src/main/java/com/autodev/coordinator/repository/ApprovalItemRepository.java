package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.ApprovalItem;
import com.autodev.coordinator.model.ApprovalStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ApprovalItemRepository extends JpaRepository<ApprovalItem, UUID> {

    /** PENDING → status, once. Returns 0 if the item was already decided. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ApprovalItem a
               SET a.status = :status, a.reviewer = :reviewer, a.reviewerNotes = :notes, a.resolvedAt = :now
             WHERE a.id = :id AND a.status = com.autodev.coordinator.model.ApprovalStatus.PENDING
            """)
    int decideIfPending(@Param("id") UUID id,
                        @Param("status") ApprovalStatus status,
                        @Param("reviewer") String reviewer,
                        @Param("notes") String notes,
                        @Param("now") Instant now);

    List<ApprovalItem> findByStatusOrderByCreatedAtAsc(ApprovalStatus status, Pageable page);

    List<ApprovalItem> findByStatusOrderByCreatedAtDesc(ApprovalStatus status, Pageable page);

    List<ApprovalItem> findAllByOrderByCreatedAtDesc(Pageable page);

    List<ApprovalItem> findByReferenceOrderByCreatedAtDesc(String reference);
}
