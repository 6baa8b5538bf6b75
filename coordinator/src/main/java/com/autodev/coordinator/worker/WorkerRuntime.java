package com.autodev.coordinator.worker;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.AgentState;
import com.autodev.coordinator.model.Outcome;
import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.service.AgentRegistryService;
import com.autodev.coordinator.service.CoordinationException;
import com.autodev.coordinator.service.NoProviderAvailableException;
import com.autodev.coordinator.service.OutcomeLedgerService;
import com.autodev.coordinator.service.ProviderHealthService;
import com.autodev.coordinator.service.TaskQueueService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One worker iteration: pick a provider, claim a task, run it, report.
 *
 * While the handler runs, a timer heartbeats the claim. If the claim is lost
 * (reclaimed or cancelled) the final complete/fail is rejected by the queue;
 * the result is logged and dropped, never retried, and no outcome is recorded.
 * The worker's state in the agent registry follows each step.
 */
@Component
public class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    static final int MAX_ERROR_CHARS = 500;

    private final TaskQueueService      taskQueue;
    private final ProviderHealthService providers;
    private final OutcomeLedgerService  ledger;
    private final TaskHandler           handler;
    private final AgentRegistryService  registry;
    private final CoordinatorProperties props;
    private final Clock                 clock;

    private final ScheduledExecutorService heartbeats = Executors.newScheduledThreadPool(1);

    public WorkerRuntime(TaskQueueService taskQueue,
                         ProviderHealthService providers,
                         OutcomeLedgerService ledger,
                         TaskHandler handler,
                         AgentRegistryService registry,
                         CoordinatorProperties props,
                         Clock clock) {
        this.taskQueue = taskQueue;
        this.providers = providers;
        this.ledger    = ledger;
        this.handler   = handler;
        this.registry  = registry;
        this.props     = props;
        this.clock     = clock;
    }

    /**
     * @return true if a task was claimed (whatever its outcome), false if there was nothing to do
     */
    public boolean runOnce(String workerId, Collection<String> acceptedTypes) {
        String provider;
        try {
            provider = providers.recommendFor(workerId);
        } catch (NoProviderAvailableException e) {
            log.info("Worker '{}' idle: every provider is limited until {}", workerId, e.getEarliestReset());
            report(workerId, AgentState.RATE_LIMITED, null);
            return false;
        }
        if (providers.current(provider).limited()) {
            log.debug("Worker '{}' idle: provider '{}' is limited", workerId, provider);
            report(workerId, AgentState.RATE_LIMITED, null);
            return false;
        }

        Optional<Task> claimed = taskQueue.claim(workerId, acceptedTypes);
        if (claimed.isEmpty()) {
            report(workerId, AgentState.IDLE, null);
            return false;
        }
        Task task = claimed.get();
        report(workerId, AgentState.WORKING, task.getId());

        // Every log line for this task carries the worker and task, in plain-text and JSON output.
        MDC.put("workerId", workerId);
        MDC.put("taskId",   task.getId().toString());
        MDC.put("taskType", task.getType());
        long interval = props.getWorker().getHeartbeatInterval().toMillis();
        ScheduledFuture<?> beat = heartbeats.scheduleAtFixedRate(
                () -> heartbeat(task, workerId), interval, interval, TimeUnit.MILLISECONDS);
        AgentState after = AgentState.IDLE;
        try {
            after = process(task, workerId, provider, beat);
        } catch (CoordinationException e) {
            if (e.getKind() == CoordinationException.Kind.NOT_OWNER) {
                log.warn("Task {} was reclaimed while '{}' worked on it; result discarded", task.getId(), workerId);
            } else if (e.getKind() == CoordinationException.Kind.INVALID_TRANSITION) {
                log.warn("Task {} left CLAIMED while '{}' worked on it (cancelled?); result discarded",
                        task.getId(), workerId);
            } else {
                throw e;
            }
        } finally {
            beat.cancel(false);
            report(workerId, after, null);
            MDC.remove("workerId");
            MDC.remove("taskId");
            MDC.remove("taskType");
        }
        return true;
    }

    /** @return the state the worker is in once the task is handed back */
    private AgentState process(Task task, String workerId, String provider, ScheduledFuture<?> beat) {
        Instant started = clock.instant();
        String context = ledger.contextFor(task, workerId);

        HandlerResult result;
        try {
            result = handler.execute(task, provider, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = HandlerResult.failure("interrupted: " + e.getMessage());
        } catch (Exception e) {
            log.error("Handler error on task {}: {}", task.getId(), e.getMessage(), e);
            result = HandlerResult.failure("handler error: " + e.getMessage());
        }
        beat.cancel(false);

        if (result.isRateLimited()) {
            providers.reportLimited(provider, result.rateLimitResetAt(), workerId);
            taskQueue.release(task.getId(), workerId, "provider '" + provider + "' rate-limited");
            return AgentState.RATE_LIMITED;
        }

        Duration took = Duration.between(started, clock.instant());
        String summary = result.outcome() == Outcome.SUCCESS ? null : summarize(result.output());
        // Only the holder whose terminal transition lands gets to record an outcome.
        if (result.outcome() == Outcome.FAILURE) {
            taskQueue.fail(task.getId(), workerId, summary);
        } else {
            taskQueue.complete(task.getId(), workerId, result.resultJson());
        }
        ledger.recordOutcome(task.getId(), workerId, task.getType(), result.outcome(), took, summary);
        if (result.outcome() == Outcome.SUCCESS) {
            try {
                registry.taskCompleted(workerId);
            } catch (RuntimeException e) {
                log.warn("Could not count completion for '{}': {}", workerId, e.getMessage());
            }
        }
        return AgentState.IDLE;
    }

    private void heartbeat(Task task, String workerId) {
        try {
            taskQueue.heartbeat(task.getId(), workerId);
        } catch (CoordinationException e) {
            log.warn("Heartbeat for task {} rejected: {}", task.getId(), e.getMessage());
            // Propagating stops further executions of this periodic beat.
            throw e;
        }
        try {
            registry.heartbeat(workerId);
        } catch (RuntimeException e) {
            log.warn("Registry heartbeat for '{}' failed: {}", workerId, e.getMessage());
        }
    }

    /** Registry writes are informational; a failure never affects the task. */
    private void report(String workerId, AgentState state, UUID taskId) {
        try {
            registry.report(workerId, state, taskId);
        } catch (RuntimeException e) {
            log.warn("Could not report '{}' as {}: {}", workerId, state, e.getMessage());
        }
    }

    static String summarize(String output) {
        if (output == null || output.isBlank()) {
            return "no output";
        }
        String trimmed = output.strip();
        return trimmed.length() <= MAX_ERROR_CHARS ? trimmed : trimmed.substring(trimmed.length() - MAX_ERROR_CHARS);
    }

    @PreDestroy
    void shutdown() {
        heartbeats.shutdownNow();
    }
}
