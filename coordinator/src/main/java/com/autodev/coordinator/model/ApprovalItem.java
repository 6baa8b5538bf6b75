package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A synchronous human checkpoint. The action named by reference (usually a
 * Task id) must not proceed while status = PENDING.
 *
 * DB table: approval_items
 */
@Entity
@Table(name = "approval_items")
public class ApprovalItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false)
    private ApprovalType itemType;

    // Task id (as a string) or an external object reference such as "mr:42".
    @Column(nullable = false)
    private String reference;

    private String title;

    @Column(name = "context_json", columnDefinition = "TEXT")
    private String contextJson;

    // Overrides the configured follow-on task type for this item.
    @Column(name = "follow_on_type")
    private String followOnType;

    @Column(name = "submitted_by", nullable = false)
    private String submittedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApprovalStatus status = ApprovalStatus.PENDING;

    private String reviewer;

    @Column(name = "reviewer_notes", columnDefinition = "TEXT")
    private String reviewerNotes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    protected ApprovalItem() {}   // required by JPA

    public ApprovalItem(ApprovalType itemType, String reference, String submittedBy) {
        this.itemType    = itemType;
        this.reference   = reference;
        this.submittedBy = submittedBy;
    }

    public UUID           getId()            { return id; }
    public ApprovalType   getItemType()      { return itemType; }
    public String         getReference()     { return reference; }
    public String         getTitle()         { return title; }
    public String         getContextJson()   { return contextJson; }
    public String         getFollowOnType()  { return followOnType; }
    public String         getSubmittedBy()   { return submittedBy; }
    public ApprovalStatus getStatus()        { return status; }
    public String         getReviewer()      { return reviewer; }
    public String         getReviewerNotes() { return reviewerNotes; }
    public Instant        getCreatedAt()     { return createdAt; }
    public Instant        getResolvedAt()    { return resolvedAt; }

    public void setTitle(String title)               { this.title = title; }
    public void setContextJson(String contextJson)   { this.contextJson = contextJson; }
    public void setFollowOnType(String followOnType) { this.followOnType = followOnType; }
    public void setStatus(ApprovalStatus status)     { this.status = status; }
    public void setReviewer(String reviewer)         { this.reviewer = reviewer; }
    public void setReviewerNotes(String notes)       { this.reviewerNotes = notes; }
    public void setCreatedAt(Instant t)              { this.createdAt = t; }
    public void setResolvedAt(Instant t)             { this.resolvedAt = t; }
}
