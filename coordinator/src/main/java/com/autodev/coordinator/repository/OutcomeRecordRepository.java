package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.Outcome;
import com.autodev.coordinator.model.OutcomeRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface OutcomeRecordRepository extends JpaRepository<OutcomeRecord, UUID> {

    @Query("""
            SELECT new com.autodev.coordinator.repository.OutcomeRollupRow(
                       o.workerId, o.outcome, COUNT(o), AVG(o.durationMs))
            FROM OutcomeRecord o
            WHERE o.createdAt >= :since
            GROUP BY o.workerId, o.outcome
            """)
    List<OutcomeRollupRow> rollupByWorker(@Param("since") Instant since);

    @Query("""
            SELECT new com.autodev.coordinator.repository.OutcomeRollupRow(
                       o.taskType, o.outcome, COUNT(o), AVG(o.durationMs))
            FROM OutcomeRecord o
            WHERE o.createdAt >= :since
            GROUP BY o.taskType, o.outcome
            """)
    List<OutcomeRollupRow> rollupByTaskType(@Param("since") Instant since);

    List<OutcomeRecord> findTop5ByTaskTypeAndOutcomeOrderByCreatedAtDesc(String taskType, Outcome outcome);

    List<OutcomeRecord> findByTaskIdOrderByCreatedAtAsc(UUID taskId);
}
