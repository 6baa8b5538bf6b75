package com.autodev.coordinator.api;

import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.model.TaskStatus;
import com.autodev.coordinator.service.CoordinationException;
import com.autodev.coordinator.service.NewTask;
import com.autodev.coordinator.service.QueueStats;
import com.autodev.coordinator.service.TaskQueueService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.autodev.coordinator.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for TaskController.
 *
 * @WebMvcTest spins up only the web layer and ApiExceptionHandler; the
 * queue service is a mock.
 */
@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean TaskQueueService taskQueue;

    // ------------------------------------------------------------------
    // POST /tasks
    // ------------------------------------------------------------------

    @Test
    void createTask_validRequest_returns201() throws Exception {
        when(taskQueue.create(any())).thenReturn(fakeTask(TaskStatus.PENDING));

        mockMvc.perform(post("/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"write_spec","priority":7,"payload":{"issue":42},"repoRef":"acme/shop"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNotEmpty())
                .andExpect(jsonPath("$.type").value("write_spec"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        ArgumentCaptor<NewTask> captor = ArgumentCaptor.forClass(NewTask.class);
        verify(taskQueue).create(captor.capture());
        assertThat(captor.getValue().payloadJson()).isEqualTo("{\"issue\":42}");
        assertThat(captor.getValue().priority()).isEqualTo(7);
        assertThat(captor.getValue().createdBy()).isEqualTo("human");
    }

    @Test
    void createTask_noPriority_usesDefault() throws Exception {
        when(taskQueue.create(any())).thenReturn(fakeTask(TaskStatus.PENDING));

        mockMvc.perform(post("/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"write_spec\"}"))
                .andExpect(status().isCreated());

        verify(taskQueue).create(argThat(req -> req.priority() == NewTask.DEFAULT_PRIORITY && req.payloadJson() == null));
    }

    @Test
    void createTask_missingType_returns400() throws Exception {
        mockMvc.perform(post("/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priority\":3}"))
                .andExpect(status().isBadRequest());

        verify(taskQueue, never()).create(any());
    }

    @Test
    void createTask_unknownParent_returns404() throws Exception {
        UUID parent = UUID.randomUUID();
        when(taskQueue.create(any())).thenThrow(CoordinationException.notFound("parent task", parent));

        mockMvc.perform(post("/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"implement_feature\",\"parentTaskId\":\"" + parent + "\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    // ------------------------------------------------------------------
    // GET /tasks, /tasks/{id}, /tasks/stats
    // ------------------------------------------------------------------

    @Test
    void getTask_existingId_returns200() throws Exception {
        Task task = fakeTask(TaskStatus.CLAIMED);
        task.setAssignedTo("w1");
        when(taskQueue.find(task.getId())).thenReturn(Optional.of(task));

        mockMvc.perform(get("/tasks/{id}", task.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CLAIMED"))
                .andExpect(jsonPath("$.assignedTo").value("w1"));
    }

    @Test
    void getTask_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(taskQueue.find(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/tasks/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void listTasks_passesFilters() throws Exception {
        when(taskQueue.list(TaskStatus.PENDING, "write_spec", null, 50))
                .thenReturn(List.of(fakeTask(TaskStatus.PENDING)));

        mockMvc.perform(get("/tasks").param("status", "PENDING").param("type", "write_spec"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void stats_returnsCounts() throws Exception {
        Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
        byStatus.put(TaskStatus.PENDING, 3L);
        when(taskQueue.stats()).thenReturn(new QueueStats(byStatus, Map.of("write_spec", 3L), Map.of()));

        mockMvc.perform(get("/tasks/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.byStatus.PENDING").value(3))
                .andExpect(jsonPath("$.pendingByType.write_spec").value(3));
    }

    // ------------------------------------------------------------------
    // POST /tasks/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_pendingTask_returnsCancelledTask() throws Exception {
        Task task = fakeTask(TaskStatus.CANCELLED);
        when(taskQueue.get(task.getId())).thenReturn(task);

        mockMvc.perform(post("/tasks/{id}/cancel", task.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"superseded\",\"cancelledBy\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        verify(taskQueue).cancel(task.getId(), "superseded", "alice");
    }

    @Test
    void cancel_finishedTask_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(CoordinationException.invalidTransition("task", id, TaskStatus.COMPLETED, "cancel"))
                .when(taskQueue).cancel(eq(id), any(), eq("human"));

        mockMvc.perform(post("/tasks/{id}/cancel", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }

    // ------------------------------------------------------------------
    // Test object factories
    // ------------------------------------------------------------------

    private Task fakeTask(TaskStatus status) {
        Task task = withId(new Task("write_spec", 7, "{\"issue\":42}"));
        task.setStatus(status);
        task.setRepoRef("acme/shop");
        return task;
    }
}
