package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.Proposal;
import com.autodev.coordinator.model.ProposalStatus;
import com.autodev.coordinator.model.Vote;
import com.autodev.coordinator.model.VoteStance;
import com.autodev.coordinator.service.Tally;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Proposal with its current tally. votes is only filled in for
 * GET /proposals/{id}; the list endpoint leaves it empty.
 */
public record ProposalResponse(
        UUID           id,
        String         author,
        String         kind,
        String         title,
        String         rationale,
        String         payloadJson,
        ProposalStatus status,
        long           votesFor,
        long           votesAgainst,
        Instant        createdAt,
        Instant        resolvedAt,
        Instant        implementedAt,
        List<VoteView> votes
) {
    public record VoteView(String voter, VoteStance stance, String reason, Instant createdAt) {
        public static VoteView from(Vote v) {
            return new VoteView(v.getVoter(), v.getStance(), v.getReason(), v.getCreatedAt());
        }
    }

    public static ProposalResponse from(Proposal p, Tally tally, List<Vote> votes) {
        return new ProposalResponse(
                p.getId(),
                p.getAuthor(),
                p.getKind(),
                p.getTitle(),
                p.getRationale(),
                p.getPayloadJson(),
                p.getStatus(),
                tally.votesFor(),
                tally.votesAgainst(),
                p.getCreatedAt(),
                p.getResolvedAt(),
                p.getImplementedAt(),
                votes.stream().map(VoteView::from).toList()
        );
    }
}
