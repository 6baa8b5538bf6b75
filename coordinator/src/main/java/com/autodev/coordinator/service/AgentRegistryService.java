package com.autodev.coordinator.service;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.AgentState;
import com.autodev.coordinator.model.AgentStatus;
import com.autodev.coordinator.repository.AgentStatusRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Registry of workers as they describe themselves: state, current task,
 * last heartbeat and how many tasks they completed. Purely informational;
 * task ownership is decided by the queue, never by this table.
 */
@Service
public class AgentRegistryService {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistryService.class);

    private final AgentStatusRepository statusRepo;
    private final CoordinatorProperties props;
    private final Clock                 clock;

    public AgentRegistryService(AgentStatusRepository statusRepo, CoordinatorProperties props, Clock clock) {
        this.statusRepo = statusRepo;
        this.props      = props;
        this.clock      = clock;
    }

    /** Record a worker's state; currentTaskId is cleared unless the worker is WORKING. */
    @Transactional
    public void report(String workerId, AgentState state, UUID currentTaskId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        UUID taskId = state == AgentState.WORKING ? currentTaskId : null;
        statusRepo.upsert(workerId, state.name(), taskId, clock.instant());
        log.debug("Worker '{}' is {}{}", workerId, state, taskId != null ? " on task " + taskId : "");
    }

    /** Refresh last_heartbeat without changing the reported state. */
    @Transactional
    public void heartbeat(String workerId) {
        statusRepo.touch(workerId, clock.instant());
    }

    @Transactional
    public void taskCompleted(String workerId) {
        if (statusRepo.incrementCompleted(workerId) == 0) {
            log.debug("No registry row for '{}'; completion not counted", workerId);
        }
    }

    @Transactional(readOnly = true)
    public List<AgentView> all() {
        Instant now = clock.instant();
        return statusRepo.findAllByOrderByWorkerIdAsc().stream()
                .map(a -> toView(a, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public AgentView get(String workerId) {
        return statusRepo.findById(workerId)
                .map(a -> toView(a, clock.instant()))
                .orElseThrow(() -> CoordinationException.notFound("worker", workerId));
    }

    private AgentView toView(AgentStatus a, Instant now) {
        Instant cutoff = now.minus(props.getTasks().getReclaimTimeout());
        boolean stale = a.getState() != AgentState.OFFLINE && a.getLastHeartbeat().isBefore(cutoff);
        return new AgentView(a.getWorkerId(), a.getState(), stale, a.getCurrentTaskId(),
                a.getLastHeartbeat(), a.getSessionStartedAt(), a.getTasksCompleted());
    }
}
