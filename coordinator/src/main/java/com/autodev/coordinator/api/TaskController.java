package com.autodev.coordinator.api;

import com.autodev.coordinator.api.dto.CancelTaskRequest;
import com.autodev.coordinator.api.dto.CreateTaskRequest;
import com.autodev.coordinator.api.dto.TaskResponse;
import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.model.TaskStatus;
import com.autodev.coordinator.service.NewTask;
import com.autodev.coordinator.service.QueueStats;
import com.autodev.coordinator.service.TaskQueueService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API over the task queue, for the dashboard and human operators.
 *
 * POST /tasks               — enqueue a task
 * GET  /tasks               — list tasks (filters: status, type, repoRef)
 * GET  /tasks/stats         — backlog counts
 * GET  /tasks/{id}          — one task
 * GET  /tasks/{id}/children — follow-on tasks
 * POST /tasks/{id}/cancel   — cancel a pending or claimed task
 *
 * Workers do not use this API; they call the service layer directly.
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskQueueService taskQueue;

    public TaskController(TaskQueueService taskQueue) {
        this.taskQueue = taskQueue;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/tasks \
     *     -H "Content-Type: application/json" \
     *     -d '{"type":"write_spec","priority":7,"payload":{"issue":42},"repoRef":"acme/shop"}'
     */
    @PostMapping
    public ResponseEntity<TaskResponse> create(@Valid @RequestBody CreateTaskRequest req) {
        NewTask newTask = NewTask.of(req.type(),
                        req.priority() != null ? req.priority() : NewTask.DEFAULT_PRIORITY,
                        req.payload() != null ? req.payload().toString() : null)
                .withRepoRef(req.repoRef())
                .withParent(req.parentTaskId())
                .withCreatedBy(req.createdBy())
                .withTargetWorker(req.targetWorker())
                .withDedupKey(req.dedupKey())
                .withGate(req.gateApprovalId());
        Task task = taskQueue.create(newTask);
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
    }

    @GetMapping
    public List<TaskResponse> list(@RequestParam(required = false) TaskStatus status,
                                   @RequestParam(required = false) String type,
                                   @RequestParam(required = false) String repoRef,
                                   @RequestParam(defaultValue = "50") int limit) {
        return taskQueue.list(status, type, repoRef, limit).stream()
                .map(TaskResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public QueueStats stats() {
        return taskQueue.stats();
    }

    /**
     * Returns 404 if the task ID is not found.
     */
    @GetMapping("/{id}")
    public TaskResponse get(@PathVariable UUID id) {
        return taskQueue.find(id)
                .map(TaskResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Task not found: " + id));
    }

    @GetMapping("/{id}/children")
    public List<TaskResponse> children(@PathVariable UUID id) {
        taskQueue.find(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: " + id));
        return taskQueue.children(id).stream()
                .map(TaskResponse::from)
                .toList();
    }

    /**
     * Cooperative: a worker holding the task notices on its next heartbeat.
     * HTTP 409 if the task already finished.
     */
    @PostMapping("/{id}/cancel")
    public TaskResponse cancel(@PathVariable UUID id, @RequestBody(required = false) CancelTaskRequest req) {
        CancelTaskRequest body = req != null ? req : new CancelTaskRequest(null, null);
        taskQueue.cancel(id, body.reason(), body.cancelledBy());
        return TaskResponse.from(taskQueue.get(id));
    }
}
