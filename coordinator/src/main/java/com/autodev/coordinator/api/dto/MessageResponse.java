package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.AgentMessage;

import java.time.Instant;
import java.util.UUID;

/** toWorker is null for broadcasts. */
public record MessageResponse(UUID id, String fromWorker, String toWorker, String type,
                              String payloadJson, Instant createdAt, Instant readAt) {

    public static MessageResponse from(AgentMessage m) {
        return new MessageResponse(m.getId(), m.getFromWorker(), m.getToWorker(), m.getType(),
                m.getPayloadJson(), m.getCreatedAt(), m.getReadAt());
    }
}
