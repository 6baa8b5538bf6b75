package com.autodev.coordinator.service;

import com.autodev.coordinator.model.AgentMessage;
import com.autodev.coordinator.repository.AgentMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Worker-to-worker messages. A null recipient is a broadcast.
 *
 * Direct messages carry a read flag. Broadcasts do not: every worker reads
 * them through its own 'since' cursor, so one reader cannot hide a
 * broadcast from the others.
 */
@Service
public class MailboxService {

    private static final Logger log = LoggerFactory.getLogger(MailboxService.class);

    private final AgentMessageRepository messageRepo;
    private final Clock                  clock;

    public MailboxService(AgentMessageRepository messageRepo, Clock clock) {
        this.messageRepo = messageRepo;
        this.clock       = clock;
    }

    @Transactional
    public AgentMessage send(String fromWorker, String toWorker, String type, String payloadJson) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("message type is required");
        }
        AgentMessage msg = new AgentMessage(fromWorker, toWorker, type, payloadJson);
        msg.setCreatedAt(clock.instant());
        AgentMessage saved = messageRepo.save(msg);
        log.debug("'{}' -> '{}' [{}] message {}", fromWorker,
                toWorker == null ? "*" : toWorker, type, saved.getId());
        return saved;
    }

    public AgentMessage broadcast(String fromWorker, String type, String payloadJson) {
        return send(fromWorker, null, type, payloadJson);
    }

    /**
     * Unread direct messages plus everything (direct or broadcast) created
     * after 'since', oldest first. A null 'since' means from the beginning.
     */
    @Transactional(readOnly = true)
    public List<AgentMessage> poll(String workerId, Instant since) {
        return messageRepo.pollFor(workerId, since != null ? since : Instant.EPOCH);
    }

    /**
     * Mark a direct message read. Marking it twice is a no-op.
     *
     * @throws CoordinationException NOT_FOUND for an unknown id, NOT_OWNER if the
     *         caller is not the recipient (broadcasts have no recipient)
     */
    @Transactional
    public void markRead(UUID messageId, String workerId) {
        if (messageRepo.markReadIfUnread(messageId, workerId, clock.instant()) > 0) {
            return;
        }
        AgentMessage msg = messageRepo.findById(messageId)
                .orElseThrow(() -> CoordinationException.notFound("message", messageId));
        if (!workerId.equals(msg.getToWorker())) {
            throw new CoordinationException(CoordinationException.Kind.NOT_OWNER,
                    "message " + messageId + " is not addressed to '" + workerId + "'");
        }
    }

    @Transactional
    public int markAllRead(String workerId) {
        return messageRepo.markAllRead(workerId, clock.instant());
    }

    /** Newest first; a null worker lists all traffic. */
    @Transactional(readOnly = true)
    public List<AgentMessage> recent(String workerId, int limit) {
        return messageRepo.recent(workerId, PageRequest.of(0, Math.max(1, limit)));
    }
}
