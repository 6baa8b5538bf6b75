package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.AgentMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface AgentMessageRepository extends JpaRepository<AgentMessage, UUID> {

    /**
     * Direct messages the worker has not marked read, plus every direct or
     * broadcast message newer than 'since'. A worker never receives its own
     * broadcasts.
     */
    @Query("""
            SELECT m FROM AgentMessage m
            WHERE (m.toWorker = :workerId AND m.readAt IS NULL)
               OR (m.toWorker = :workerId AND m.createdAt > :since)
               OR (m.toWorker IS NULL AND m.fromWorker <> :workerId AND m.createdAt > :since)
            ORDER BY m.createdAt ASC
            """)
    List<AgentMessage> pollFor(@Param("workerId") String workerId, @Param("since") Instant since);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE AgentMessage m SET m.readAt = :now
            WHERE m.id = :id AND m.toWorker = :workerId AND m.readAt IS NULL
            """)
    int markReadIfUnread(@Param("id") UUID id, @Param("workerId") String workerId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AgentMessage m SET m.readAt = :now WHERE m.toWorker = :workerId AND m.readAt IS NULL")
    int markAllRead(@Param("workerId") String workerId, @Param("now") Instant now);

    @Query("""
            SELECT m FROM AgentMessage m
            WHERE (:workerId IS NULL OR m.toWorker = :workerId OR m.fromWorker = :workerId)
            ORDER BY m.createdAt DESC
            """)
    List<AgentMessage> recent(@Param("workerId") String workerId, Pageable page);
}
