package com.autodev.coordinator.service;

import com.autodev.coordinator.model.DiscussionPost;
import com.autodev.coordinator.repository.DiscussionPostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Append-only, topic-organised discussion board shared by all workers. */
@Service
public class DiscussionService {

    private static final Logger log = LoggerFactory.getLogger(DiscussionService.class);

    public static final String APPROVALS_TOPIC = "approvals";

    private final DiscussionPostRepository postRepo;
    private final Clock                    clock;

    public DiscussionService(DiscussionPostRepository postRepo, Clock clock) {
        this.postRepo = postRepo;
        this.clock    = clock;
    }

    public static String proposalTopic(UUID proposalId) {
        return "proposal:" + proposalId;
    }

    @Transactional
    public DiscussionPost post(String author, String topic, String content) {
        return post(author, topic, content, null);
    }

    /**
     * @throws CoordinationException NOT_FOUND if inReplyTo names an unknown post
     */
    @Transactional
    public DiscussionPost post(String author, String topic, String content, UUID inReplyTo) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        if (inReplyTo != null && !postRepo.existsById(inReplyTo)) {
            throw CoordinationException.notFound("discussion post", inReplyTo);
        }
        DiscussionPost post = new DiscussionPost(author, topic, content, inReplyTo);
        post.setCreatedAt(clock.instant());
        DiscussionPost saved = postRepo.save(post);
        log.debug("'{}' posted {} on '{}'", author, saved.getId(), topic);
        return saved;
    }

    /** Newest first. Null topic means every topic, null since means all time. */
    @Transactional(readOnly = true)
    public List<DiscussionPost> list(String topic, Instant since, int limit) {
        return postRepo.search(topic, since != null ? since : Instant.EPOCH,
                PageRequest.of(0, Math.max(1, limit)));
    }

    /** The post followed by its direct replies, oldest reply first. */
    @Transactional(readOnly = true)
    public List<DiscussionPost> thread(UUID postId) {
        DiscussionPost root = postRepo.findById(postId)
                .orElseThrow(() -> CoordinationException.notFound("discussion post", postId));
        List<DiscussionPost> thread = new ArrayList<>();
        thread.add(root);
        thread.addAll(postRepo.findByInReplyToOrderByCreatedAtAsc(postId));
        return thread;
    }
}
