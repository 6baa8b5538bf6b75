package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.AgentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface AgentStatusRepository extends JpaRepository<AgentStatus, String> {

    /**
     * Insert or overwrite a worker's state. A worker coming back from OFFLINE
     * starts a new session; tasks_completed is never reset.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            INSERT INTO agent_status (worker_id, state, current_task_id, last_heartbeat, session_started_at, tasks_completed)
            VALUES (:workerId, :state, CAST(:taskId AS uuid), :now, :now, 0)
            ON CONFLICT (worker_id) DO UPDATE
               SET state              = EXCLUDED.state,
                   current_task_id    = EXCLUDED.current_task_id,
                   last_heartbeat     = EXCLUDED.last_heartbeat,
                   session_started_at = CASE WHEN agent_status.state = 'OFFLINE'
                                             THEN EXCLUDED.session_started_at
                                             ELSE agent_status.session_started_at END
            """, nativeQuery = true)
    int upsert(@Param("workerId") String workerId,
               @Param("state") String state,
               @Param("taskId") UUID taskId,
               @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AgentStatus a SET a.lastHeartbeat = :now WHERE a.workerId = :workerId")
    int touch(@Param("workerId") String workerId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AgentStatus a SET a.tasksCompleted = a.tasksCompleted + 1 WHERE a.workerId = :workerId")
    int incrementCompleted(@Param("workerId") String workerId);

    List<AgentStatus> findAllByOrderByWorkerIdAsc();
}
