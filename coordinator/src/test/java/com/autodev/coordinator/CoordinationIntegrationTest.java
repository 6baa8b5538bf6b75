package com.autodev.coordinator;

import com.autodev.coordinator.model.AgentMessage;
import com.autodev.coordinator.model.AgentState;
import com.autodev.coordinator.model.ApprovalItem;
import com.autodev.coordinator.model.ApprovalStatus;
import com.autodev.coordinator.model.ApprovalType;
import com.autodev.coordinator.model.Decision;
import com.autodev.coordinator.model.Outcome;
import com.autodev.coordinator.model.Proposal;
import com.autodev.coordinator.model.ProposalStatus;
import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.model.TaskStatus;
import com.autodev.coordinator.model.VoteStance;
import com.autodev.coordinator.service.AgentRegistryService;
import com.autodev.coordinator.service.AgentView;
import com.autodev.coordinator.service.ApprovalService;
import com.autodev.coordinator.service.CoordinationException;
import com.autodev.coordinator.service.DiscussionService;
import com.autodev.coordinator.service.LockConflictException;
import com.autodev.coordinator.service.LockService;
import com.autodev.coordinator.service.MailboxService;
import com.autodev.coordinator.service.NewTask;
import com.autodev.coordinator.service.OutcomeLedgerService;
import com.autodev.coordinator.service.OutcomeStats;
import com.autodev.coordinator.service.ProposalService;
import com.autodev.coordinator.service.ProviderHealthService;
import com.autodev.coordinator.service.ReclaimReport;
import com.autodev.coordinator.service.ResourceKeys;
import com.autodev.coordinator.service.TaskQueueService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end coordination against a real Postgres, where SKIP LOCKED, the
 * ON CONFLICT upserts and the unique constraints actually apply.
 *
 * Each test uses its own task types and worker ids so they do not see each
 * other's rows in the shared database.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class CoordinationIntegrationTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Autowired TaskQueueService      taskQueue;
    @Autowired LockService           locks;
    @Autowired MailboxService        mailbox;
    @Autowired DiscussionService     discussion;
    @Autowired ProposalService       proposals;
    @Autowired ApprovalService       approvals;
    @Autowired ProviderHealthService providers;
    @Autowired OutcomeLedgerService  ledger;
    @Autowired AgentRegistryService  agents;
    @Autowired ObjectMapper          json;

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ------------------------------------------------------------------
    // Task queue
    // ------------------------------------------------------------------

    @Test
    void concurrentClaimers_eachTaskClaimedExactlyOnce() throws Exception {
        String type = unique("batch");
        int tasks = 20;
        for (int i = 0; i < tasks; i++) {
            taskQueue.create(NewTask.of(type, 5, "{\"n\":" + i + "}"));
        }

        ExecutorService pool = Executors.newFixedThreadPool(6);
        List<Callable<List<UUID>>> claimers = new ArrayList<>();
        for (int w = 0; w < 6; w++) {
            String workerId = unique("claimer");
            claimers.add(() -> {
                List<UUID> mine = new ArrayList<>();
                Optional<Task> next;
                while ((next = taskQueue.claim(workerId, List.of(type))).isPresent()) {
                    mine.add(next.get().getId());
                    taskQueue.complete(next.get().getId(), workerId, "{}");
                }
                return mine;
            });
        }
        List<UUID> all = new ArrayList<>();
        for (Future<List<UUID>> f : pool.invokeAll(claimers)) {
            all.addAll(f.get());
        }
        pool.shutdown();
        pool.awaitTermination(10, TimeUnit.SECONDS);

        assertThat(all).hasSize(tasks);
        assertThat(new HashSet<>(all)).hasSize(tasks);
    }

    @Test
    void claim_highestPriorityFirst_thenOldest() {
        String type = unique("prio");
        Task low  = taskQueue.create(NewTask.of(type, 3, null));
        Task high = taskQueue.create(NewTask.of(type, 9, null));
        Task mid1 = taskQueue.create(NewTask.of(type, 5, null));
        Task mid2 = taskQueue.create(NewTask.of(type, 5, null));
        String w = unique("w");

        assertThat(taskQueue.claim(w, List.of(type))).get().extracting(Task::getId).isEqualTo(high.getId());
        assertThat(taskQueue.claim(w, List.of(type))).get().extracting(Task::getId).isEqualTo(mid1.getId());
        assertThat(taskQueue.claim(w, List.of(type))).get().extracting(Task::getId).isEqualTo(mid2.getId());
        assertThat(taskQueue.claim(w, List.of(type))).get().extracting(Task::getId).isEqualTo(low.getId());
        assertThat(taskQueue.claim(w, List.of(type))).isEmpty();
    }

    @Test
    void targetedTask_onlyClaimableByItsTarget() {
        String type = unique("targeted");
        String target = unique("w");
        Task task = taskQueue.create(NewTask.of(type, 5, null).withTargetWorker(target));

        assertThat(taskQueue.claim(unique("other"), List.of(type))).isEmpty();
        assertThat(taskQueue.claim(target, List.of("something_else"))).get()
                .extracting(Task::getId).isEqualTo(task.getId());
    }

    @Test
    void dedupKey_secondLiveCreateReturnsExistingTask() {
        String type = unique("review_pr");
        Task first  = taskQueue.create(NewTask.of(type, 5, null).withDedupKey("mr-17"));
        Task second = taskQueue.create(NewTask.of(type, 5, null).withDedupKey("mr-17"));

        assertThat(second.getId()).isEqualTo(first.getId());
    }

    @Test
    void silentWorkerReclaimed_itsLateCompletionIsRejected() throws Exception {
        String type = unique("slow");
        String zombie = unique("zombie");
        Task task = taskQueue.create(NewTask.of(type, 5, null));
        taskQueue.claim(zombie, List.of(type)).orElseThrow();
        Thread.sleep(20);

        ReclaimReport report = taskQueue.reclaimStale(Duration.ofMillis(10));

        assertThat(report.reclaimed()).contains(task.getId());
        Task reclaimed = taskQueue.get(task.getId());
        assertThat(reclaimed.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(reclaimed.getAssignedTo()).isNull();
        assertThat(reclaimed.getRetryCount()).isEqualTo(1);
        assertThat(reclaimed.getNotBefore()).isAfter(Instant.now());
        // Backed off: not claimable yet.
        assertThat(taskQueue.claim(unique("w"), List.of(type))).isEmpty();

        assertThatThrownBy(() -> taskQueue.complete(task.getId(), zombie, "{\"late\":true}"))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.NOT_OWNER));
        assertThat(taskQueue.get(task.getId()).getResultJson()).isNull();
    }

    @Test
    void cancelledWhileClaimed_holderLearnsOnHeartbeat() {
        String type = unique("cancel");
        String w = unique("w");
        Task task = taskQueue.create(NewTask.of(type, 5, null));
        taskQueue.claim(w, List.of(type)).orElseThrow();

        taskQueue.cancel(task.getId(), "superseded", "alice");

        assertThatThrownBy(() -> taskQueue.heartbeat(task.getId(), w))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.INVALID_TRANSITION));
        assertThat(taskQueue.get(task.getId()).getStatus()).isEqualTo(TaskStatus.CANCELLED);
    }

    // ------------------------------------------------------------------
    // Resource locks
    // ------------------------------------------------------------------

    @Test
    void concurrentAcquirers_exactlyOneWins() throws Exception {
        String key = ResourceKeys.file(unique("repo"), "src/Cart.java");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<Boolean>> attempts = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String holder = unique("w");
            attempts.add(() -> locks.tryAcquire(key, holder, Duration.ofMinutes(5)).isPresent());
        }
        int winners = 0;
        for (Future<Boolean> f : pool.invokeAll(attempts)) {
            if (f.get()) winners++;
        }
        pool.shutdown();

        assertThat(winners).isEqualTo(1);
    }

    @Test
    void lock_heldByOther_conflictUntilReleasedOrExpired() throws Exception {
        String key = ResourceKeys.file(unique("repo"), "src/Cart.java");
        locks.acquire(key, "w1", Duration.ofMinutes(5));

        assertThatThrownBy(() -> locks.acquire(key, "w2", Duration.ofMinutes(5)))
                .isInstanceOfSatisfying(LockConflictException.class,
                        e -> assertThat(e.getHolder()).isEqualTo("w1"));

        assertThat(locks.release(key, "w2")).isFalse();
        assertThat(locks.release(key, "w1")).isTrue();
        assertThat(locks.acquire(key, "w2", Duration.ofMillis(50)).getHolder()).isEqualTo("w2");

        Thread.sleep(100);
        // w2's lease lapsed: w1 may take it over.
        assertThat(locks.tryAcquire(key, "w1", Duration.ofMinutes(1))).isPresent();
        assertThat(locks.holderOf(key)).get().extracting(l -> l.getHolder()).isEqualTo("w1");
    }

    @Test
    void withLock_releasesAfterWork() throws Exception {
        String key = ResourceKeys.repository(unique("repo"));

        String result = locks.withLock(key, "w1", Duration.ofMinutes(1), () -> {
            assertThat(locks.holderOf(key)).isPresent();
            return "merged";
        });

        assertThat(result).isEqualTo("merged");
        assertThat(locks.holderOf(key)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Mailbox
    // ------------------------------------------------------------------

    @Test
    void mailbox_directAndBroadcastDelivery() {
        String sender = unique("w");
        String recipient = unique("w");
        Instant before = Instant.now().minusSeconds(1);
        AgentMessage direct = mailbox.send(sender, recipient, "review_request", "{\"mr\":17}");
        mailbox.broadcast(sender, "heads_up", "{\"file\":\"Cart.java\"}");

        List<AgentMessage> inbox = mailbox.poll(recipient, before);
        assertThat(inbox).extracting(AgentMessage::getType).contains("review_request", "heads_up");
        assertThat(mailbox.poll(sender, before)).extracting(AgentMessage::getType).doesNotContain("heads_up");

        mailbox.markRead(direct.getId(), recipient);
        mailbox.markRead(direct.getId(), recipient);
        assertThat(mailbox.poll(recipient, Instant.now().plusSeconds(1)))
                .extracting(AgentMessage::getId).doesNotContain(direct.getId());
    }

    // ------------------------------------------------------------------
    // Proposals
    // ------------------------------------------------------------------

    @Test
    void proposal_closesOnceQuorumReached_laterVotesRejected() {
        Proposal p = proposals.propose("w1", "refactor", "Split Cart", "too big", null);

        proposals.vote(p.getId(), "w1", VoteStance.FOR, "my idea");
        assertThatThrownBy(() -> proposals.vote(p.getId(), "w1", VoteStance.AGAINST, null))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.DUPLICATE_VOTE));
        proposals.vote(p.getId(), "w2", VoteStance.AGAINST, "churn");
        assertThat(proposals.get(p.getId()).getStatus()).isEqualTo(ProposalStatus.OPEN);
        proposals.vote(p.getId(), "w3", VoteStance.FOR, null);

        // 2 of 3 in favour meets the 0.6 threshold at quorum 3.
        assertThat(proposals.get(p.getId()).getStatus()).isEqualTo(ProposalStatus.APPROVED);
        assertThat(proposals.resolve(p.getId())).isEqualTo(Decision.APPROVED);
        assertThatThrownBy(() -> proposals.vote(p.getId(), "w4", VoteStance.AGAINST, null))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.ALREADY_RESOLVED));

        assertThat(discussion.list(DiscussionService.proposalTopic(p.getId()), null, 10))
                .anyMatch(post -> post.getAuthor().equals("system") && post.getContent().startsWith("APPROVED"));
    }

    @Test
    void simultaneousVotesReachingQuorum_closeProposal() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        for (int round = 0; round < 5; round++) {
            Proposal p = proposals.propose("w1", "add_worker", unique("Add reviewer"), null, null);
            proposals.vote(p.getId(), "w1", VoteStance.FOR, null);

            CountDownLatch start = new CountDownLatch(1);
            List<Callable<Object>> voters = new ArrayList<>();
            for (String voter : List.of("w2", "w3")) {
                voters.add(() -> {
                    start.await();
                    return proposals.vote(p.getId(), voter, VoteStance.FOR, null);
                });
            }
            List<Future<Object>> votes = new ArrayList<>();
            for (Callable<Object> v : voters) {
                votes.add(pool.submit(v));
            }
            start.countDown();
            for (Future<Object> f : votes) {
                f.get(10, TimeUnit.SECONDS);
            }

            assertThat(proposals.get(p.getId()).getStatus()).isEqualTo(ProposalStatus.APPROVED);
        }
        pool.shutdown();
    }

    @Test
    void approvedProposal_markedImplementedOnce() {
        Proposal p = proposals.propose("w1", "rule_change", unique("Require tests"), null, null);
        assertThatThrownBy(() -> proposals.markImplemented(p.getId(), "w1"))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.INVALID_TRANSITION));
        for (String voter : List.of("w1", "w2", "w3")) {
            proposals.vote(p.getId(), voter, VoteStance.FOR, null);
        }
        assertThat(proposals.approved(true)).extracting(Proposal::getId).contains(p.getId());

        Proposal done = proposals.markImplemented(p.getId(), "w2");

        assertThat(done.getStatus()).isEqualTo(ProposalStatus.IMPLEMENTED);
        assertThat(done.getImplementedAt()).isNotNull();
        assertThat(proposals.resolve(p.getId())).isEqualTo(Decision.APPROVED);
        assertThat(proposals.approved(true)).extracting(Proposal::getId).doesNotContain(p.getId());
        assertThat(proposals.approved(false)).extracting(Proposal::getId).contains(p.getId());
        assertThatThrownBy(() -> proposals.markImplemented(p.getId(), "w2"))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.INVALID_TRANSITION));
    }

    // ------------------------------------------------------------------
    // Approval gate
    // ------------------------------------------------------------------

    @Test
    void approvedSpec_enqueuesImplementationTaskLinkedToSpecTask() throws Exception {
        String writer = unique("writer");
        Task spec = taskQueue.create(NewTask.of("write_spec", 6, "{\"issue\":42}")
                .withRepoRef("acme/shop")
                .withTargetWorker(writer));
        Task claimed = taskQueue.claim(writer, List.of("write_spec")).orElseThrow();
        assertThat(claimed.getId()).isEqualTo(spec.getId());
        taskQueue.complete(claimed.getId(), writer, "{\"spec_path\":\"docs/checkout.md\"}");

        ApprovalItem item = approvals.submit(ApprovalType.SPEC, claimed.getId().toString(), writer,
                "Checkout spec", null, null);
        approvals.decide(item.getId(), ApprovalStatus.APPROVED, "mind the tax rules", "alice");

        List<Task> children = taskQueue.children(claimed.getId());
        assertThat(children).hasSize(1);
        Task followOn = children.get(0);
        assertThat(followOn.getType()).isEqualTo("implement_feature");
        assertThat(followOn.getPriority()).isEqualTo(8);
        assertThat(followOn.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(followOn.getRepoRef()).isEqualTo("acme/shop");
        JsonNode payload = json.readTree(followOn.getPayloadJson());
        assertThat(payload.get("reviewer_notes").asText()).isEqualTo("mind the tax rules");
        assertThat(payload.get("parent_result").get("spec_path").asText()).isEqualTo("docs/checkout.md");

        assertThatThrownBy(() -> approvals.decide(item.getId(), ApprovalStatus.REJECTED, null, "bob"))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.ALREADY_RESOLVED));
    }

    @Test
    void gatedTask_claimableOnlyAfterApproval() {
        String type = unique("deploy");
        String w = unique("w");
        ApprovalItem gate = approvals.submit(ApprovalType.DEPLOY, unique("release"), w);
        Task task = taskQueue.create(NewTask.of(type, 5, null).withGate(gate.getId()));

        assertThat(taskQueue.claim(w, List.of(type))).isEmpty();

        approvals.decide(gate.getId(), ApprovalStatus.APPROVED, null, "alice");

        assertThat(taskQueue.claim(w, List.of(type))).get().extracting(Task::getId).isEqualTo(task.getId());
    }

    @Test
    void rejectedItem_notifiesSubmitterAndCancelsGatedTasks() {
        String type = unique("merge");
        String submitter = unique("w");
        Instant before = Instant.now().minusSeconds(1);
        ApprovalItem gate = approvals.submit(ApprovalType.MERGE, unique("mr"), submitter);
        Task gated = taskQueue.create(NewTask.of(type, 5, null).withGate(gate.getId()));

        approvals.decide(gate.getId(), ApprovalStatus.REJECTED, "needs tests", "alice");

        assertThat(taskQueue.get(gated.getId()).getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(mailbox.poll(submitter, before))
                .anyMatch(m -> m.getType().equals(ApprovalService.REJECTED_MESSAGE_TYPE)
                        && m.getPayloadJson().contains("needs tests"));
    }

    // ------------------------------------------------------------------
    // Provider health and ledger
    // ------------------------------------------------------------------

    @Test
    void limitedProvider_fallsBackUntilCleared() {
        String preferred = unique("prov");
        String fallback  = unique("prov");
        providers.reportLimited(preferred, Instant.now().plusSeconds(3600), "w1");

        assertThat(providers.selectProvider(preferred, fallback)).isEqualTo(fallback);

        providers.clear(preferred, "alice");
        assertThat(providers.selectProvider(preferred, fallback)).isEqualTo(preferred);
    }

    @Test
    void agentRegistry_tracksStateTaskAndCompletions() {
        String worker = unique("w");
        Task task = taskQueue.create(NewTask.of(unique("type"), 5, null));

        agents.report(worker, AgentState.ONLINE, null);
        Instant sessionStart = agents.get(worker).sessionStartedAt();
        agents.report(worker, AgentState.WORKING, task.getId());
        assertThat(agents.get(worker)).satisfies(a -> {
            assertThat(a.state()).isEqualTo(AgentState.WORKING);
            assertThat(a.currentTaskId()).isEqualTo(task.getId());
            assertThat(a.stale()).isFalse();
        });

        agents.taskCompleted(worker);
        agents.report(worker, AgentState.IDLE, null);

        AgentView idle = agents.get(worker);
        assertThat(idle.state()).isEqualTo(AgentState.IDLE);
        assertThat(idle.currentTaskId()).isNull();
        assertThat(idle.tasksCompleted()).isEqualTo(1);
        assertThat(idle.sessionStartedAt()).isEqualTo(sessionStart);
        assertThat(agents.all()).extracting(AgentView::workerId).contains(worker);
    }

    @Test
    void ledger_aggregatesRecentOutcomes() {
        String worker = unique("w");
        String type = unique("type");
        ledger.recordOutcome(UUID.randomUUID(), worker, type, Outcome.SUCCESS, Duration.ofSeconds(10), null);
        ledger.recordOutcome(UUID.randomUUID(), worker, type, Outcome.SUCCESS, Duration.ofSeconds(30), null);
        ledger.recordOutcome(UUID.randomUUID(), worker, type, Outcome.FAILURE, Duration.ofSeconds(20), "boom");

        OutcomeStats stats = ledger.aggregate(Duration.ofHours(1));

        assertThat(stats.byWorker()).filteredOn(r -> r.key().equals(worker)).singleElement()
                .satisfies(r -> {
                    assertThat(r.success()).isEqualTo(2);
                    assertThat(r.failure()).isEqualTo(1);
                    assertThat(r.avgDurationMs()).isEqualTo(20_000.0);
                });
        assertThat(ledger.recentFailures(type, 5)).singleElement()
                .satisfies(f -> assertThat(f.getErrorSummary()).isEqualTo("boom"));
    }
}
