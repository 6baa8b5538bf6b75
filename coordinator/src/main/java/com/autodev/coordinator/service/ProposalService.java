package com.autodev.coordinator.service;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.Decision;
import com.autodev.coordinator.model.Proposal;
import com.autodev.coordinator.model.ProposalStatus;
import com.autodev.coordinator.model.Vote;
import com.autodev.coordinator.model.VoteStance;
import com.autodev.coordinator.repository.ProposalRepository;
import com.autodev.coordinator.repository.VoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Structured group decisions: workers propose, every worker votes at most
 * once, and the proposal closes when the consensus rule says so.
 *
 * Closing is a compare-and-set on status = OPEN, so two workers resolving
 * at the same moment agree on one outcome and one resolved_at. Votes on one
 * proposal are serialized on its row lock, so the vote that reaches quorum
 * always sees the votes before it.
 */
@Service
public class ProposalService {

    private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

    static final String SYSTEM_AUTHOR = "system";

    private final ProposalRepository    proposalRepo;
    private final VoteRepository        voteRepo;
    private final DiscussionService     discussion;
    private final CoordinatorProperties props;
    private final CoordinatorMetrics    metrics;
    private final Clock                 clock;

    public ProposalService(ProposalRepository proposalRepo,
                           VoteRepository voteRepo,
                           DiscussionService discussion,
                           CoordinatorProperties props,
                           CoordinatorMetrics metrics,
                           Clock clock) {
        this.proposalRepo = proposalRepo;
        this.voteRepo     = voteRepo;
        this.discussion   = discussion;
        this.props        = props;
        this.metrics      = metrics;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Propose / vote
    // ------------------------------------------------------------------

    /** Open a proposal and announce it on its discussion topic. */
    @Transactional
    public Proposal propose(String author, String kind, String title, String rationale, String payloadJson) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("proposal title is required");
        }
        Proposal proposal = new Proposal(author, kind, title, rationale, payloadJson);
        proposal.setCreatedAt(clock.instant());
        Proposal saved = proposalRepo.save(proposal);
        discussion.post(author, DiscussionService.proposalTopic(saved.getId()),
                "Proposal [" + kind + "] " + title + (rationale != null ? "\n\n" + rationale : ""));
        log.info("'{}' opened proposal {} [{}] '{}'", author, saved.getId(), kind, title);
        return saved;
    }

    /**
     * Record one vote, then try to close the proposal with the configured
     * quorum and threshold.
     *
     * @throws CoordinationException NOT_FOUND for an unknown proposal, ALREADY_RESOLVED
     *         if it is closed, DUPLICATE_VOTE if the voter already voted
     */
    @Transactional
    public Vote vote(UUID proposalId, String voter, VoteStance stance, String reason) {
        Proposal proposal = proposalRepo.findByIdForUpdate(proposalId)
                .orElseThrow(() -> CoordinationException.notFound("proposal", proposalId));
        if (proposal.getStatus() != ProposalStatus.OPEN) {
            throw CoordinationException.alreadyResolved("proposal", proposalId, proposal.getStatus());
        }
        if (voteRepo.existsByProposalIdAndVoter(proposalId, voter)) {
            throw CoordinationException.duplicateVote(proposalId, voter);
        }

        Vote vote = new Vote(proposal, voter, stance, reason);
        vote.setCreatedAt(clock.instant());
        try {
            vote = voteRepo.saveAndFlush(vote);
        } catch (DataIntegrityViolationException e) {
            // Concurrent vote by the same voter won the unique constraint.
            throw CoordinationException.duplicateVote(proposalId, voter);
        }
        metrics.voteCast(stance.name());
        log.info("'{}' voted {} on proposal {}", voter, stance, proposalId);

        if (reason != null && !reason.isBlank()) {
            discussion.post(voter, DiscussionService.proposalTopic(proposalId), stance + ": " + reason);
        }
        evaluate(proposal, props.getProposals().getQuorum(), props.getProposals().getThreshold());
        return vote;
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    /**
     * Evaluate the current votes. A final decision is persisted once; later
     * calls (and the loser of a concurrent resolve) get the stored outcome.
     */
    @Transactional
    public Decision resolve(UUID proposalId, int quorum, double threshold) {
        Proposal proposal = proposalRepo.findById(proposalId)
                .orElseThrow(() -> CoordinationException.notFound("proposal", proposalId));
        return evaluate(proposal, quorum, threshold);
    }

    public Decision resolve(UUID proposalId) {
        return resolve(proposalId, props.getProposals().getQuorum(), props.getProposals().getThreshold());
    }

    /**
     * Re-evaluate every OPEN proposal with the configured quorum and threshold.
     * Picks up proposals whose last vote was counted before an earlier vote committed.
     *
     * @return number of proposals closed by this pass
     */
    @Transactional
    public int resolveOpen() {
        int quorum = props.getProposals().getQuorum();
        double threshold = props.getProposals().getThreshold();
        int closed = 0;
        for (Proposal proposal : proposalRepo.findByStatusOrderByCreatedAtAsc(ProposalStatus.OPEN)) {
            if (evaluate(proposal, quorum, threshold).isFinal()) {
                closed++;
            }
        }
        return closed;
    }

    private Decision evaluate(Proposal proposal, int quorum, double threshold) {
        UUID proposalId = proposal.getId();
        if (proposal.getStatus() != ProposalStatus.OPEN) {
            return Decision.fromStatus(proposal.getStatus());
        }

        Tally tally = tally(proposalId);
        Decision decision = ConsensusRule.evaluate(tally, quorum, threshold);
        if (!decision.isFinal()) {
            return decision;
        }

        Instant now = clock.instant();
        if (proposalRepo.resolveIfOpen(proposalId, decision.toStatus(), now) == 0) {
            ProposalStatus stored = proposalRepo.findById(proposalId).orElseThrow().getStatus();
            log.debug("Proposal {} was resolved concurrently as {}", proposalId, stored);
            return Decision.fromStatus(stored);
        }
        discussion.post(SYSTEM_AUTHOR, DiscussionService.proposalTopic(proposalId),
                String.format(Locale.ROOT, "%s with %d/%d votes in favour (%.0f%%)",
                        decision, tally.votesFor(), tally.total(), tally.approvalRate() * 100));
        log.info("Proposal {} {} ({} for, {} against, quorum={}, threshold={})",
                proposalId, decision, tally.votesFor(), tally.votesAgainst(), quorum, threshold);
        return decision;
    }

    // ------------------------------------------------------------------
    // Implementation tracking
    // ------------------------------------------------------------------

    /**
     * Record that an approved proposal has been carried out.
     *
     * @throws CoordinationException NOT_FOUND for an unknown proposal,
     *         INVALID_TRANSITION unless it is APPROVED
     */
    @Transactional
    public Proposal markImplemented(UUID proposalId, String by) {
        if (proposalRepo.markImplementedIfApproved(proposalId, clock.instant()) == 0) {
            Proposal current = proposalRepo.findById(proposalId)
                    .orElseThrow(() -> CoordinationException.notFound("proposal", proposalId));
            throw CoordinationException.invalidTransition("proposal", proposalId, current.getStatus(), "implement");
        }
        discussion.post(by, DiscussionService.proposalTopic(proposalId), "Implemented");
        log.info("Proposal {} marked implemented by '{}'", proposalId, by);
        return get(proposalId);
    }

    /**
     * Approved proposals waiting to be carried out, oldest decision first; or,
     * with pendingOnly false, every approved or implemented one, newest first.
     */
    @Transactional(readOnly = true)
    public List<Proposal> approved(boolean pendingOnly) {
        return pendingOnly
                ? proposalRepo.findByStatusOrderByResolvedAtAsc(ProposalStatus.APPROVED)
                : proposalRepo.findByStatusInOrderByResolvedAtDesc(
                        List.of(ProposalStatus.APPROVED, ProposalStatus.IMPLEMENTED));
    }

    // ------------------------------------------------------------------
    // Read projections
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Tally tally(UUID proposalId) {
        return new Tally(voteRepo.countByProposalIdAndStance(proposalId, VoteStance.FOR),
                         voteRepo.countByProposalIdAndStance(proposalId, VoteStance.AGAINST));
    }

    @Transactional(readOnly = true)
    public Proposal get(UUID proposalId) {
        return proposalRepo.findById(proposalId)
                .orElseThrow(() -> CoordinationException.notFound("proposal", proposalId));
    }

    @Transactional(readOnly = true)
    public List<Proposal> list(ProposalStatus status) {
        return status == null
                ? proposalRepo.findAllByOrderByCreatedAtDesc()
                : proposalRepo.findByStatusOrderByCreatedAtDesc(status);
    }

    @Transactional(readOnly = true)
    public List<Vote> votes(UUID proposalId) {
        return voteRepo.findByProposalIdOrderByCreatedAtAsc(proposalId);
    }
}
