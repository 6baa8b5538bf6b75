package com.autodev.coordinator.service;

import com.autodev.coordinator.memory.MemoryRecord;
import com.autodev.coordinator.memory.MemorySink;
import com.autodev.coordinator.model.Learning;
import com.autodev.coordinator.model.Outcome;
import com.autodev.coordinator.model.OutcomeRecord;
import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.repository.LearningRepository;
import com.autodev.coordinator.repository.OutcomeRecordRepository;
import com.autodev.coordinator.repository.OutcomeRollupRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record of how tasks went, plus the learnings workers distil
 * from them. Both feed back into the context a worker gets for its next
 * task, and are handed to the long-term memory store after commit.
 */
@Service
public class OutcomeLedgerService {

    private static final Logger log = LoggerFactory.getLogger(OutcomeLedgerService.class);

    /** Learnings recorded under this worker id are offered to every worker. */
    public static final String SHARED_POOL = "general";

    static final int CONTEXT_LEARNINGS = 5;
    static final int CONTEXT_FAILURES  = 3;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final OutcomeRecordRepository outcomeRepo;
    private final LearningRepository      learningRepo;
    private final MemorySink              memory;
    private final CoordinatorMetrics      metrics;
    private final Clock                   clock;

    public OutcomeLedgerService(OutcomeRecordRepository outcomeRepo,
                                LearningRepository learningRepo,
                                MemorySink memory,
                                CoordinatorMetrics metrics,
                                Clock clock) {
        this.outcomeRepo  = outcomeRepo;
        this.learningRepo = learningRepo;
        this.memory       = memory;
        this.metrics      = metrics;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    @Transactional
    public OutcomeRecord recordOutcome(UUID taskId, String workerId, String taskType,
                                       Outcome outcome, Duration duration, String errorSummary) {
        OutcomeRecord record = new OutcomeRecord(taskId, workerId, taskType, outcome,
                duration != null ? duration.toMillis() : null, errorSummary);
        record.setCreatedAt(clock.instant());
        OutcomeRecord saved = outcomeRepo.save(record);
        metrics.outcomeRecorded(outcome.name());
        log.info("Outcome {} for task {} (type={}, worker={}, duration={})",
                outcome, taskId, taskType, workerId, duration);

        String content = "Task " + taskType + " " + outcome.name().toLowerCase(Locale.ROOT)
                + (errorSummary != null ? ": " + errorSummary : "");
        handOff(new MemoryRecord(outcome.name().toLowerCase(Locale.ROOT),
                List.of(taskType, workerId, "outcome"), content, importanceOf(outcome), saved.getCreatedAt()));
        return saved;
    }

    /** Rollup of every outcome recorded within the last 'window'. */
    @Transactional(readOnly = true)
    public OutcomeStats aggregate(Duration window) {
        Instant since = clock.instant().minus(window);
        List<OutcomeRollupRow> byWorkerRows = outcomeRepo.rollupByWorker(since);

        Map<Outcome, Long> totals = new EnumMap<>(Outcome.class);
        for (Outcome o : Outcome.values()) {
            totals.put(o, 0L);
        }
        byWorkerRows.forEach(r -> totals.merge(r.outcome(), r.count(), Long::sum));

        return new OutcomeStats(since, totals,
                rollup(byWorkerRows),
                rollup(outcomeRepo.rollupByTaskType(since)));
    }

    /** Fold (key, outcome) rows into one rollup per key, averaging durations by count. */
    static List<OutcomeRollup> rollup(List<OutcomeRollupRow> rows) {
        Map<String, long[]>  counts = new LinkedHashMap<>();
        Map<String, double[]> durations = new LinkedHashMap<>();
        for (OutcomeRollupRow row : rows) {
            long[] c = counts.computeIfAbsent(row.key(), k -> new long[3]);
            c[row.outcome().ordinal()] += row.count();
            if (row.avgDurationMs() != null) {
                double[] d = durations.computeIfAbsent(row.key(), k -> new double[2]);
                d[0] += row.avgDurationMs() * row.count();
                d[1] += row.count();
            }
        }
        List<OutcomeRollup> result = new ArrayList<>();
        counts.forEach((key, c) -> {
            double[] d = durations.get(key);
            result.add(new OutcomeRollup(key,
                    c[Outcome.SUCCESS.ordinal()],
                    c[Outcome.FAILURE.ordinal()],
                    c[Outcome.PARTIAL.ordinal()],
                    d != null && d[1] > 0 ? d[0] / d[1] : null));
        });
        return result;
    }

    @Transactional(readOnly = true)
    public List<OutcomeRecord> recentFailures(String taskType, int limit) {
        List<OutcomeRecord> failures = outcomeRepo.findTop5ByTaskTypeAndOutcomeOrderByCreatedAtDesc(taskType, Outcome.FAILURE);
        return failures.size() > limit ? failures.subList(0, limit) : failures;
    }

    @Transactional(readOnly = true)
    public List<OutcomeRecord> forTask(UUID taskId) {
        return outcomeRepo.findByTaskIdOrderByCreatedAtAsc(taskId);
    }

    // ------------------------------------------------------------------
    // Learnings
    // ------------------------------------------------------------------

    /**
     * @param confidence 0..1
     */
    @Transactional
    public Learning recordLearning(String workerId, String category, String content, double confidence) {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("learning content is required");
        }
        Learning learning = new Learning(workerId, category, content, confidence);
        learning.setCreatedAt(clock.instant());
        Learning saved = learningRepo.save(learning);
        log.info("'{}' recorded {} learning {} (confidence={})", workerId, category, saved.getId(), confidence);

        handOff(new MemoryRecord("lesson", List.of(category, workerId, "learning"),
                content, importanceOf(confidence), saved.getCreatedAt()));
        return saved;
    }

    /**
     * Count one more confirmation of a learning. The content never changes.
     *
     * @throws CoordinationException NOT_FOUND for an unknown learning
     */
    @Transactional
    public Learning reinforce(UUID learningId) {
        if (learningRepo.incrementValidation(learningId, clock.instant()) == 0) {
            throw CoordinationException.notFound("learning", learningId);
        }
        return learningRepo.findById(learningId).orElseThrow();
    }

    /** The worker's own learnings and the shared pool, most validated first. */
    @Transactional(readOnly = true)
    public List<Learning> learningsFor(String workerId, int limit) {
        return learningRepo.findRelevant(workerId, SHARED_POOL, PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<Learning> allLearnings(int limit) {
        return learningRepo.findAllByOrderByValidationCountDescCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Markdown block prepended to a worker's prompt: its best learnings and
     * the latest failures on the same task type. Empty when there is neither.
     */
    @Transactional(readOnly = true)
    public String contextFor(Task task, String workerId) {
        return formatContext(learningsFor(workerId, CONTEXT_LEARNINGS),
                recentFailures(task.getType(), CONTEXT_FAILURES), task.getType());
    }

    static String formatContext(List<Learning> learnings, List<OutcomeRecord> failures, String taskType) {
        StringBuilder sb = new StringBuilder();
        if (!learnings.isEmpty()) {
            sb.append("## Relevant Learnings from Previous Work\n\n");
            for (Learning l : learnings) {
                sb.append("### ").append(l.getCategory())
                  .append(" (confidence ").append(String.format(Locale.ROOT, "%.1f", l.getConfidence()))
                  .append(", validated ").append(l.getValidationCount()).append("x)\n")
                  .append(l.getContent()).append("\n\n");
            }
        }
        if (!failures.isEmpty()) {
            sb.append("## Recent Failures on ").append(taskType).append(" Tasks\n\n");
            for (OutcomeRecord f : failures) {
                sb.append("- ").append(DAY.format(f.getCreatedAt()))
                  .append(" (").append(f.getWorkerId()).append("): ")
                  .append(f.getErrorSummary() != null ? f.getErrorSummary() : "no error summary")
                  .append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Long-term memory hand-off
    // ------------------------------------------------------------------

    static int importanceOf(Outcome outcome) {
        return switch (outcome) {
            case FAILURE -> 7;
            case PARTIAL -> 5;
            case SUCCESS -> 3;
        };
    }

    static int importanceOf(double confidence) {
        return Math.max(1, Math.min(10, (int) Math.round(confidence * 10)));
    }

    /** Store after commit so a rolled-back ledger write never reaches the memory store. */
    private void handOff(MemoryRecord record) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    storeQuietly(record);
                }
            });
        } else {
            storeQuietly(record);
        }
    }

    private void storeQuietly(MemoryRecord record) {
        try {
            memory.store(record);
        } catch (Exception e) {
            // Ledger row is already committed; the memory store is best-effort.
            log.warn("Memory hand-off of {} record failed: {}", record.type(), e.getMessage());
        }
    }
}
