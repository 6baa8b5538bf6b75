package com.autodev.coordinator.worker;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.AgentState;
import com.autodev.coordinator.service.AgentRegistryService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Drives the in-process workers listed under autodev.worker.ids.
 *
 * The DB is the queue: every tick, each idle worker gets one runOnce() on
 * the fixed pool. A worker is never run twice concurrently, and the pool
 * caps how many tasks this process works on at once.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "autodev.worker", name = "enabled", havingValue = "true")
public class WorkerScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkerScheduler.class);

    private final WorkerRuntime         runtime;
    private final AgentRegistryService  registry;
    private final CoordinatorProperties props;
    private final ExecutorService       workers;
    private final Set<String>           busy = ConcurrentHashMap.newKeySet();

    public WorkerScheduler(WorkerRuntime runtime, AgentRegistryService registry, CoordinatorProperties props) {
        this.runtime  = runtime;
        this.registry = registry;
        this.props    = props;
        this.workers = Executors.newFixedThreadPool(props.getWorker().getPoolSize());
        log.info("Worker scheduler started for {} (pool size {})",
                props.getWorker().getIds(), props.getWorker().getPoolSize());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void announce() {
        reportAll(AgentState.ONLINE);
    }

    @Scheduled(fixedDelayString = "${autodev.worker.poll-interval:5s}")
    public void tick() {
        for (String workerId : props.getWorker().getIds()) {
            if (!busy.add(workerId)) {
                continue;   // still working on its previous task
            }
            workers.submit(() -> {
                try {
                    runtime.runOnce(workerId, props.getWorker().acceptedTypesFor(workerId));
                } catch (Exception e) {
                    log.error("Unhandled error in worker '{}': {}", workerId, e.getMessage(), e);
                } finally {
                    busy.remove(workerId);
                }
            });
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
        reportAll(AgentState.OFFLINE);
    }

    private void reportAll(AgentState state) {
        for (String workerId : props.getWorker().getIds()) {
            try {
                registry.report(workerId, state, null);
            } catch (RuntimeException e) {
                log.warn("Could not report '{}' as {}: {}", workerId, state, e.getMessage());
            }
        }
    }
}
