package com.autodev.coordinator.api.dto;

import com.autodev.coordinator.model.DiscussionPost;

import java.time.Instant;
import java.util.UUID;

public record DiscussionPostResponse(UUID id, String author, String topic, String content,
                                     UUID inReplyTo, Instant createdAt) {

    public static DiscussionPostResponse from(DiscussionPost p) {
        return new DiscussionPostResponse(p.getId(), p.getAuthor(), p.getTopic(), p.getContent(),
                p.getInReplyTo(), p.getCreatedAt());
    }
}
