package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A distilled insight a worker recorded after a task. Content never changes;
 * later tasks that corroborate it bump validation_count instead.
 *
 * DB table: learnings
 */
@Entity
@Table(name = "learnings")
public class Learning {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private String workerId;

    @Column(nullable = false, updatable = false)
    private String category;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String content;

    // 0.0 - 1.0
    @Column(nullable = false, updatable = false)
    private double confidence;

    @Column(name = "validation_count", nullable = false)
    private int validationCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "last_validated_at")
    private Instant lastValidatedAt;

    protected Learning() {}   // required by JPA

    public Learning(String workerId, String category, String content, double confidence) {
        this.workerId   = workerId;
        this.category   = category;
        this.content    = content;
        this.confidence = confidence;
    }

    public UUID    getId()              { return id; }
    public String  getWorkerId()        { return workerId; }
    public String  getCategory()        { return category; }
    public String  getContent()         { return content; }
    public double  getConfidence()      { return confidence; }
    public int     getValidationCount() { return validationCount; }
    public Instant getCreatedAt()       { return createdAt; }
    public Instant getLastValidatedAt() { return lastValidatedAt; }

    public void setCreatedAt(Instant t) { this.createdAt = t; }
}
