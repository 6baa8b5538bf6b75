package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only entry in the shared discussion log, grouped by free-text topic.
 *
 * DB table: discussion_posts
 */
@Entity
@Table(name = "discussion_posts")
public class DiscussionPost {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private String author;

    @Column(nullable = false, updatable = false)
    private String topic;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "in_reply_to", updatable = false)
    private UUID inReplyTo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected DiscussionPost() {}   // required by JPA

    public DiscussionPost(String author, String topic, String content, UUID inReplyTo) {
        this.author    = author;
        this.topic     = topic;
        this.content   = content;
        this.inReplyTo = inReplyTo;
    }

    public UUID    getId()        { return id; }
    public String  getAuthor()    { return author; }
    public String  getTopic()     { return topic; }
    public String  getContent()   { return content; }
    public UUID    getInReplyTo() { return inReplyTo; }
    public Instant getCreatedAt() { return createdAt; }

    public void setCreatedAt(Instant t) { this.createdAt = t; }
}
