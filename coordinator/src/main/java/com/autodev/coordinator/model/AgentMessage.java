package com.autodev.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Point-to-point (or broadcast, when toWorker is null) message between
 * workers. Delivery is at-least-once via polling.
 *
 * DB table: messages
 */
@Entity
@Table(name = "messages")
public class AgentMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "from_worker", nullable = false)
    private String fromWorker;

    // Null means broadcast to every worker.
    @Column(name = "to_worker")
    private String toWorker;

    @Column(nullable = false)
    private String type;

    @Column(name = "payload_json", columnDefinition = "TEXT")
    private String payloadJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "read_at")
    private Instant readAt;

    protected AgentMessage() {}   // required by JPA

    public AgentMessage(String fromWorker, String toWorker, String type, String payloadJson) {
        this.fromWorker  = fromWorker;
        this.toWorker    = toWorker;
        this.type        = type;
        this.payloadJson = payloadJson;
    }

    public UUID    getId()          { return id; }
    public String  getFromWorker()  { return fromWorker; }
    public String  getToWorker()    { return toWorker; }
    public String  getType()        { return type; }
    public String  getPayloadJson() { return payloadJson; }
    public Instant getCreatedAt()   { return createdAt; }
    public Instant getReadAt()      { return readAt; }

    public boolean isBroadcast()            { return toWorker == null; }
    public void setCreatedAt(Instant t)     { this.createdAt = t; }
    public void setReadAt(Instant t)        { this.readAt = t; }
}
