package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.DiscussionPost;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface DiscussionPostRepository extends JpaRepository<DiscussionPost, UUID> {

    @Query("""
            SELECT p FROM DiscussionPost p
            WHERE (:topic IS NULL OR p.topic = :topic)
              AND p.createdAt > :since
            ORDER BY p.createdAt DESC
            """)
    List<DiscussionPost> search(@Param("topic") String topic, @Param("since") Instant since, Pageable page);

    List<DiscussionPost> findByInReplyToOrderByCreatedAtAsc(UUID inReplyTo);
}
