package com.autodev.coordinator.service;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.ApprovalItem;
import com.autodev.coordinator.model.ApprovalStatus;
import com.autodev.coordinator.model.ApprovalType;
import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.repository.ApprovalItemRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Human checkpoint. An item is PENDING until a reviewer decides it, and the
 * decision is taken exactly once (compare-and-set on status = PENDING).
 *
 * The consequences of a decision are applied in the same transaction:
 *   - APPROVED: the follow-on task for the referenced task is enqueued and
 *               tasks gated on the item become claimable
 *   - REJECTED: the submitter gets an "approval_rejected" message with the
 *               reviewer's notes and gated tasks are cancelled
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    public static final String REJECTED_MESSAGE_TYPE = "approval_rejected";

    private final ApprovalItemRepository approvalRepo;
    private final TaskQueueService       taskQueue;
    private final MailboxService         mailbox;
    private final DiscussionService      discussion;
    private final CoordinatorProperties  props;
    private final CoordinatorMetrics     metrics;
    private final ObjectMapper           json;
    private final Clock                  clock;

    public ApprovalService(ApprovalItemRepository approvalRepo,
                           TaskQueueService taskQueue,
                           MailboxService mailbox,
                           DiscussionService discussion,
                           CoordinatorProperties props,
                           CoordinatorMetrics metrics,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.approvalRepo = approvalRepo;
        this.taskQueue    = taskQueue;
        this.mailbox      = mailbox;
        this.discussion   = discussion;
        this.props        = props;
        this.metrics      = metrics;
        this.json         = objectMapper;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    @Transactional
    public ApprovalItem submit(ApprovalType itemType, String reference, String submittedBy) {
        return submit(itemType, reference, submittedBy, null, null, null);
    }

    /**
     * Queue an item for human review and announce it on the "approvals" topic.
     *
     * @param reference    id of the task this item gates, or an external pointer (MR, deploy id)
     * @param followOnType task type to enqueue on approval; null uses the per-item-type default
     */
    @Transactional
    public ApprovalItem submit(ApprovalType itemType, String reference, String submittedBy,
                               String title, String contextJson, String followOnType) {
        if (itemType == null) {
            throw new IllegalArgumentException("item type is required");
        }
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("reference is required");
        }
        ApprovalItem item = new ApprovalItem(itemType, reference, submittedBy);
        item.setTitle(title);
        item.setContextJson(contextJson);
        item.setFollowOnType(followOnType);
        item.setCreatedAt(clock.instant());
        ApprovalItem saved = approvalRepo.save(item);

        discussion.post(submittedBy, DiscussionService.APPROVALS_TOPIC,
                "Awaiting approval [" + itemType + "] " + (title != null ? title : reference)
                        + " (item " + saved.getId() + ")");
        log.info("'{}' submitted {} approval {} for '{}'", submittedBy, itemType, saved.getId(), reference);
        return saved;
    }

    // ------------------------------------------------------------------
    // Decision
    // ------------------------------------------------------------------

    /**
     * Approve or reject a pending item and apply the side effects.
     *
     * @param decision APPROVED or REJECTED
     * @throws CoordinationException NOT_FOUND for an unknown item, ALREADY_RESOLVED
     *         if it was decided before
     */
    @Transactional
    public ApprovalItem decide(UUID itemId, ApprovalStatus decision, String notes, String reviewer) {
        if (decision == null || decision == ApprovalStatus.PENDING) {
            throw new IllegalArgumentException("decision must be APPROVED or REJECTED, got " + decision);
        }
        if (approvalRepo.decideIfPending(itemId, decision, reviewer, notes, clock.instant()) == 0) {
            ApprovalItem current = approvalRepo.findById(itemId)
                    .orElseThrow(() -> CoordinationException.notFound("approval item", itemId));
            throw CoordinationException.alreadyResolved("approval item", itemId, current.getStatus());
        }

        ApprovalItem item = approvalRepo.findById(itemId).orElseThrow();
        metrics.approvalDecided(item.getItemType().name(), decision.name());
        log.info("Approval {} [{}] {} by '{}'", itemId, item.getItemType(), decision, reviewer);

        if (decision == ApprovalStatus.APPROVED) {
            onApproved(item);
        } else {
            onRejected(item);
        }
        return item;
    }

    private void onApproved(ApprovalItem item) {
        discussion.post(item.getReviewer(), DiscussionService.APPROVALS_TOPIC,
                "APPROVED: " + describe(item) + notesSuffix(item));

        Optional<Task> referenced = parseTaskId(item.getReference()).flatMap(taskQueue::find);
        if (referenced.isEmpty()) {
            log.debug("Approval {} does not reference a task, no follow-on", item.getId());
            return;
        }
        String followOnType = item.getFollowOnType() != null
                ? item.getFollowOnType()
                : props.getApprovals().getFollowOnTypes().get(item.getItemType());
        if (followOnType == null) {
            log.debug("No follow-on task type configured for {} approvals", item.getItemType());
            return;
        }

        Task parent = referenced.get();
        Task followOn = taskQueue.create(
                NewTask.of(followOnType, props.getApprovals().getFollowOnPriority(), followOnPayload(item, parent))
                        .withParent(parent.getId())
                        .withRepoRef(parent.getRepoRef())
                        .withCreatedBy("approval:" + item.getId()));
        log.info("Approval {} enqueued follow-on task {} ({}) after task {}",
                item.getId(), followOn.getId(), followOnType, parent.getId());
    }

    private void onRejected(ApprovalItem item) {
        discussion.post(item.getReviewer(), DiscussionService.APPROVALS_TOPIC,
                "REJECTED: " + describe(item) + notesSuffix(item));

        ObjectNode payload = json.createObjectNode();
        payload.put("approval_id", item.getId().toString());
        payload.put("item_type",   item.getItemType().name());
        payload.put("reference",   item.getReference());
        payload.put("reason",      item.getReviewerNotes());
        mailbox.send(item.getReviewer() != null ? item.getReviewer() : "human",
                item.getSubmittedBy(), REJECTED_MESSAGE_TYPE, toJson(payload));

        taskQueue.cancelGatedBy(item.getId(), "approval " + item.getId() + " rejected");
    }

    // ------------------------------------------------------------------
    // Read projections
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public ApprovalItem get(UUID itemId) {
        return approvalRepo.findById(itemId)
                .orElseThrow(() -> CoordinationException.notFound("approval item", itemId));
    }

    @Transactional(readOnly = true)
    public boolean isApproved(UUID itemId) {
        return get(itemId).getStatus() == ApprovalStatus.APPROVED;
    }

    /** PENDING items oldest first (review order); any other filter newest first. */
    @Transactional(readOnly = true)
    public List<ApprovalItem> list(ApprovalStatus status, int limit) {
        if (status == null) {
            return approvalRepo.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
        }
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return status == ApprovalStatus.PENDING
                ? approvalRepo.findByStatusOrderByCreatedAtAsc(status, page)
                : approvalRepo.findByStatusOrderByCreatedAtDesc(status, page);
    }

    @Transactional(readOnly = true)
    public List<ApprovalItem> forReference(String reference) {
        return approvalRepo.findByReferenceOrderByCreatedAtDesc(reference);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String followOnPayload(ApprovalItem item, Task parent) {
        ObjectNode payload = json.createObjectNode();
        payload.put("approval_id",    item.getId().toString());
        payload.put("title",          item.getTitle());
        payload.put("reviewer_notes", item.getReviewerNotes());
        payload.put("parent_type",    parent.getType());
        payload.set("context",        parseOrText(item.getContextJson()));
        payload.set("parent_result",  parseOrText(parent.getResultJson()));
        return toJson(payload);
    }

    private JsonNode parseOrText(String raw) {
        if (raw == null) {
            return json.nullNode();
        }
        try {
            return json.readTree(raw);
        } catch (JsonProcessingException e) {
            return json.getNodeFactory().textNode(raw);
        }
    }

    private String toJson(JsonNode node) {
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    static Optional<UUID> parseTaskId(String reference) {
        try {
            return Optional.of(UUID.fromString(reference));
        } catch (IllegalArgumentException notAUuid) {
            return Optional.empty();
        }
    }

    private static String describe(ApprovalItem item) {
        return "[" + item.getItemType() + "] " + (item.getTitle() != null ? item.getTitle() : item.getReference());
    }

    private static String notesSuffix(ApprovalItem item) {
        return item.getReviewerNotes() != null && !item.getReviewerNotes().isBlank()
                ? " (" + item.getReviewerNotes() + ")"
                : "";
    }
}
