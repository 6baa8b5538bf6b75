package com.autodev.coordinator.worker;

import com.autodev.coordinator.service.LockService;
import com.autodev.coordinator.service.ProposalService;
import com.autodev.coordinator.service.ReclaimReport;
import com.autodev.coordinator.service.TaskQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Self-healing sweep: returns abandoned claims to the queue, drops expired
 * leases and closes proposals that reached quorum without being resolved.
 * Every process runs it; concurrent sweeps skip each other's locked rows.
 */
@Component
@EnableScheduling
public class MaintenanceSweeper {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceSweeper.class);

    private final TaskQueueService taskQueue;
    private final LockService      locks;
    private final ProposalService  proposals;

    public MaintenanceSweeper(TaskQueueService taskQueue, LockService locks, ProposalService proposals) {
        this.taskQueue = taskQueue;
        this.locks     = locks;
        this.proposals = proposals;
    }

    @Scheduled(fixedDelayString = "${autodev.tasks.sweep-interval:60s}",
               initialDelayString = "${autodev.tasks.sweep-interval:60s}")
    public void sweep() {
        try {
            ReclaimReport report = taskQueue.reclaimStale();
            if (!report.isEmpty()) {
                log.info("Sweep reclaimed {} task(s), force-failed {}",
                        report.reclaimed().size(), report.poisoned().size());
            }
        } catch (Exception e) {
            log.error("Stale-claim sweep failed: {}", e.getMessage(), e);
        }
        try {
            locks.purgeExpired();
        } catch (Exception e) {
            log.error("Expired-lock purge failed: {}", e.getMessage(), e);
        }
        try {
            int closed = proposals.resolveOpen();
            if (closed > 0) {
                log.info("Sweep closed {} proposal(s)", closed);
            }
        } catch (Exception e) {
            log.error("Proposal resolution sweep failed: {}", e.getMessage(), e);
        }
    }
}
