package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One worker's stance on a proposal. (proposal_id, voter) is unique in the
 * schema, so a second vote from the same worker fails at insert time.
 *
 * DB table: votes
 */
@Entity
@Table(name = "votes")
public class Vote {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "proposal_id", nullable = false)
    private Proposal proposal;

    @Column(nullable = false)
    private String voter;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private VoteStance stance;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Vote() {}   // required by JPA

    public Vote(Proposal proposal, String voter, VoteStance stance, String reason) {
        this.proposal = proposal;
        this.voter    = voter;
        this.stance   = stance;
        this.reason   = reason;
    }

    public UUID       getId()        { return id; }
    public Proposal   getProposal()  { return proposal; }
    public String     getVoter()     { return voter; }
    public VoteStance getStance()    { return stance; }
    public String     getReason()    { return reason; }
    public Instant    getCreatedAt() { return createdAt; }

    public void setCreatedAt(Instant t) { this.createdAt = t; }
}
