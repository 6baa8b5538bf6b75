package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A structured group decision (add-worker, remove-worker, rule-change, ...)
 * that workers vote on. Status moves OPEN → APPROVED/REJECTED exactly once,
 * guarded by a compare-and-set update in the repository. An approved
 * proposal is later marked IMPLEMENTED by whoever carries it out.
 *
 * DB table: proposals
 */
@Entity
@Table(name = "proposals")
public class Proposal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String author;

    @Column(nullable = false)
    private String kind;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String rationale;

    @Column(name = "payload_json", columnDefinition = "TEXT")
    private String payloadJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProposalStatus status = ProposalStatus.OPEN;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "implemented_at")
    private Instant implementedAt;

    protected Proposal() {}   // required by JPA

    public Proposal(String author, String kind, String title, String rationale, String payloadJson) {
        this.author      = author;
        this.kind        = kind;
        this.title       = title;
        this.rationale   = rationale;
        this.payloadJson = payloadJson;
    }

    public UUID           getId()          { return id; }
    public String         getAuthor()      { return author; }
    public String         getKind()        { return kind; }
    public String         getTitle()       { return title; }
    public String         getRationale()   { return rationale; }
    public String         getPayloadJson() { return payloadJson; }
    public ProposalStatus getStatus()      { return status; }
    public Instant        getCreatedAt()   { return createdAt; }
    public Instant        getResolvedAt()  { return resolvedAt; }
    public Instant        getImplementedAt() { return implementedAt; }

    public void setStatus(ProposalStatus status) { this.status = status; }
    public void setCreatedAt(Instant t)          { this.createdAt = t; }
    public void setResolvedAt(Instant t)         { this.resolvedAt = t; }
    public void setImplementedAt(Instant t)      { this.implementedAt = t; }
}
