package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.Proposal;
import com.autodev.coordinator.model.ProposalStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProposalRepository extends JpaRepository<Proposal, UUID> {

    /**
     * Row-locks the proposal for the rest of the transaction. Votes take this
     * lock first, so each one counts every vote committed before it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Proposal p WHERE p.id = :id")
    Optional<Proposal> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Compare-and-set OPEN → status. Only the first resolver gets 1 back;
     * everyone else gets 0 and must read the persisted outcome.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Proposal p SET p.status = :status, p.resolvedAt = :now
            WHERE p.id = :id AND p.status = com.autodev.coordinator.model.ProposalStatus.OPEN
            """)
    int resolveIfOpen(@Param("id") UUID id, @Param("status") ProposalStatus status, @Param("now") Instant now);

    /** APPROVED → IMPLEMENTED, once. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Proposal p SET p.status = com.autodev.coordinator.model.ProposalStatus.IMPLEMENTED,
                                  p.implementedAt = :now
            WHERE p.id = :id AND p.status = com.autodev.coordinator.model.ProposalStatus.APPROVED
            """)
    int markImplementedIfApproved(@Param("id") UUID id, @Param("now") Instant now);

    List<Proposal> findByStatusOrderByCreatedAtDesc(ProposalStatus status);

    List<Proposal> findByStatusOrderByCreatedAtAsc(ProposalStatus status);

    List<Proposal> findByStatusOrderByResolvedAtAsc(ProposalStatus status);

    List<Proposal> findByStatusInOrderByResolvedAtDesc(List<ProposalStatus> statuses);

    List<Proposal> findAllByOrderByCreatedAtDesc();
}
