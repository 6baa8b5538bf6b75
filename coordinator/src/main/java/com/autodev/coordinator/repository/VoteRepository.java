package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.Vote;
import com.autodev.coordinator.model.VoteStance;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface VoteRepository extends JpaRepository<Vote, UUID> {

    boolean existsByProposalIdAndVoter(UUID proposalId, String voter);

    long countByProposalIdAndStance(UUID proposalId, VoteStance stance);

    List<Vote> findByProposalIdOrderByCreatedAtAsc(UUID proposalId);
}
