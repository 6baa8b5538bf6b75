package com.autodev.coordinator.service;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.ApprovalItem;
import com.autodev.coordinator.model.ApprovalStatus;
import com.autodev.coordinator.model.ApprovalType;
import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.repository.ApprovalItemRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.autodev.coordinator.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ApprovalService: the follow-on task on approval and the
 * notification plus gated-task cancellation on rejection.
 */
@ExtendWith(MockitoExtension.class)
class ApprovalServiceTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock ApprovalItemRepository approvalRepo;
    @Mock TaskQueueService       taskQueue;
    @Mock MailboxService         mailbox;
    @Mock DiscussionService      discussion;

    final ObjectMapper json = new ObjectMapper();

    ApprovalService service;

    @BeforeEach
    void setUp() {
        service = new ApprovalService(approvalRepo, taskQueue, mailbox, discussion,
                new CoordinatorProperties(),
                new CoordinatorMetrics(new SimpleMeterRegistry()),
                json, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_persistsPendingItemAndAnnouncesIt() {
        when(approvalRepo.save(any())).thenAnswer(inv -> withId((ApprovalItem) inv.getArgument(0)));

        ApprovalItem item = service.submit(ApprovalType.SPEC, UUID.randomUUID().toString(), "w1",
                "Checkout spec", "{\"pages\":3}", null);

        assertThat(item.getStatus()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(item.getCreatedAt()).isEqualTo(NOW);
        verify(discussion).post(eq("w1"), eq(DiscussionService.APPROVALS_TOPIC), contains("Checkout spec"));
    }

    @Test
    void submit_blankReference_rejected() {
        assertThatThrownBy(() -> service.submit(ApprovalType.MERGE, " ", "w1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // decide(APPROVED)
    // ------------------------------------------------------------------

    @Test
    void approveSpec_enqueuesImplementationTaskUnderReferencedTask() throws Exception {
        Task specTask = withId(new Task("write_spec", 5, null));
        specTask.setRepoRef("acme/shop");
        specTask.setResultJson("{\"spec_path\":\"docs/checkout.md\"}");
        ApprovalItem item = decided(ApprovalType.SPEC, specTask.getId().toString(), ApprovalStatus.APPROVED,
                "ship it, mind the tax rules");
        item.setTitle("Checkout spec");

        when(approvalRepo.decideIfPending(item.getId(), ApprovalStatus.APPROVED, "alice", "ship it, mind the tax rules", NOW))
                .thenReturn(1);
        when(approvalRepo.findById(item.getId())).thenReturn(Optional.of(item));
        when(taskQueue.find(specTask.getId())).thenReturn(Optional.of(specTask));
        when(taskQueue.create(any())).thenAnswer(inv -> {
            NewTask req = inv.getArgument(0);
            return withId(new Task(req.type(), req.priority(), req.payloadJson()));
        });

        service.decide(item.getId(), ApprovalStatus.APPROVED, "ship it, mind the tax rules", "alice");

        ArgumentCaptor<NewTask> captor = ArgumentCaptor.forClass(NewTask.class);
        verify(taskQueue).create(captor.capture());
        NewTask followOn = captor.getValue();
        assertThat(followOn.type()).isEqualTo("implement_feature");
        assertThat(followOn.priority()).isEqualTo(8);
        assertThat(followOn.parentTaskId()).isEqualTo(specTask.getId());
        assertThat(followOn.repoRef()).isEqualTo("acme/shop");
        assertThat(followOn.createdBy()).isEqualTo("approval:" + item.getId());

        JsonNode payload = json.readTree(followOn.payloadJson());
        assertThat(payload.get("approval_id").asText()).isEqualTo(item.getId().toString());
        assertThat(payload.get("reviewer_notes").asText()).isEqualTo("ship it, mind the tax rules");
        assertThat(payload.get("parent_result").get("spec_path").asText()).isEqualTo("docs/checkout.md");
    }

    @Test
    void approve_explicitFollowOnType_overridesDefault() {
        Task parent = withId(new Task("open_pr", 5, null));
        ApprovalItem item = decided(ApprovalType.MERGE, parent.getId().toString(), ApprovalStatus.APPROVED, null);
        item.setFollowOnType("merge_and_tag");
        when(approvalRepo.decideIfPending(any(), any(), any(), any(), any())).thenReturn(1);
        when(approvalRepo.findById(item.getId())).thenReturn(Optional.of(item));
        when(taskQueue.find(parent.getId())).thenReturn(Optional.of(parent));
        when(taskQueue.create(any())).thenAnswer(inv -> withId(new Task("merge_and_tag", 8, null)));

        service.decide(item.getId(), ApprovalStatus.APPROVED, null, "alice");

        verify(taskQueue).create(argThat(req -> req.type().equals("merge_and_tag")));
    }

    @Test
    void approve_externalReference_noFollowOnTask() {
        ApprovalItem item = decided(ApprovalType.DEPLOY, "deploy-2026-03-01", ApprovalStatus.APPROVED, null);
        when(approvalRepo.decideIfPending(any(), any(), any(), any(), any())).thenReturn(1);
        when(approvalRepo.findById(item.getId())).thenReturn(Optional.of(item));

        service.decide(item.getId(), ApprovalStatus.APPROVED, null, "alice");

        verify(taskQueue, never()).create(any());
        verifyNoInteractions(mailbox);
    }

    // ------------------------------------------------------------------
    // decide(REJECTED)
    // ------------------------------------------------------------------

    @Test
    void reject_notifiesSubmitterAndCancelsGatedTasks() {
        ApprovalItem item = decided(ApprovalType.SPEC, UUID.randomUUID().toString(), ApprovalStatus.REJECTED,
                "missing the migration plan");
        when(approvalRepo.decideIfPending(any(), any(), any(), any(), any())).thenReturn(1);
        when(approvalRepo.findById(item.getId())).thenReturn(Optional.of(item));

        service.decide(item.getId(), ApprovalStatus.REJECTED, "missing the migration plan", "alice");

        verify(mailbox).send(eq("alice"), eq("w1"), eq(ApprovalService.REJECTED_MESSAGE_TYPE),
                contains("missing the migration plan"));
        verify(taskQueue).cancelGatedBy(eq(item.getId()), any());
        verify(taskQueue, never()).create(any());
    }

    // ------------------------------------------------------------------
    // decide() failures
    // ------------------------------------------------------------------

    @Test
    void decide_alreadyDecided_throwsAlreadyResolved() {
        ApprovalItem item = decided(ApprovalType.SPEC, "x", ApprovalStatus.APPROVED, null);
        when(approvalRepo.decideIfPending(any(), any(), any(), any(), any())).thenReturn(0);
        when(approvalRepo.findById(item.getId())).thenReturn(Optional.of(item));

        assertThatThrownBy(() -> service.decide(item.getId(), ApprovalStatus.REJECTED, null, "bob"))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.ALREADY_RESOLVED));
        verifyNoInteractions(taskQueue, mailbox);
    }

    @Test
    void decide_unknownItem_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(approvalRepo.decideIfPending(any(), any(), any(), any(), any())).thenReturn(0);
        when(approvalRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.decide(id, ApprovalStatus.APPROVED, null, "bob"))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.NOT_FOUND));
    }

    @Test
    void decide_pendingIsNotADecision() {
        assertThatThrownBy(() -> service.decide(UUID.randomUUID(), ApprovalStatus.PENDING, null, "bob"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(approvalRepo);
    }

    // ------------------------------------------------------------------
    // list()
    // ------------------------------------------------------------------

    @Test
    void list_pending_usesOldestFirstQuery() {
        when(approvalRepo.findByStatusOrderByCreatedAtAsc(eq(ApprovalStatus.PENDING), any(Pageable.class)))
                .thenReturn(List.of());

        assertThat(service.list(ApprovalStatus.PENDING, 10)).isEmpty();
        verify(approvalRepo, never()).findByStatusOrderByCreatedAtDesc(any(), any());
    }

    // ------------------------------------------------------------------
    // Test object factories
    // ------------------------------------------------------------------

    /** An item as the repository returns it after decideIfPending succeeded. */
    private ApprovalItem decided(ApprovalType type, String reference, ApprovalStatus status, String notes) {
        ApprovalItem item = withId(new ApprovalItem(type, reference, "w1"));
        item.setStatus(status);
        item.setReviewer("alice");
        item.setReviewerNotes(notes);
        item.setResolvedAt(NOW);
        return item;
    }
}
