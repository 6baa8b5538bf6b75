package com.autodev.coordinator.service;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.AgentState;
import com.autodev.coordinator.model.AgentStatus;
import com.autodev.coordinator.repository.AgentStatusRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentRegistryServiceTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock AgentStatusRepository statusRepo;

    AgentRegistryService service;

    @BeforeEach
    void setUp() {
        service = new AgentRegistryService(statusRepo, new CoordinatorProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void report_working_keepsCurrentTask() {
        UUID taskId = UUID.randomUUID();

        service.report("w1", AgentState.WORKING, taskId);

        verify(statusRepo).upsert("w1", "WORKING", taskId, NOW);
    }

    @Test
    void report_notWorking_clearsCurrentTask() {
        service.report("w1", AgentState.IDLE, UUID.randomUUID());

        verify(statusRepo).upsert("w1", "IDLE", null, NOW);
    }

    @Test
    void report_blankWorker_rejected() {
        assertThatThrownBy(() -> service.report(" ", AgentState.IDLE, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(statusRepo);
    }

    @Test
    void all_workerSilentPastReclaimTimeout_isStale() {
        // Default reclaim timeout is 5 minutes.
        when(statusRepo.findAllByOrderByWorkerIdAsc()).thenReturn(List.of(
                new AgentStatus("w1", AgentState.WORKING, UUID.randomUUID(), NOW.minusSeconds(600)),
                new AgentStatus("w2", AgentState.IDLE, null, NOW.minusSeconds(10)),
                new AgentStatus("w3", AgentState.OFFLINE, null, NOW.minusSeconds(86_400))));

        List<AgentView> views = service.all();

        assertThat(views).extracting(AgentView::workerId).containsExactly("w1", "w2", "w3");
        assertThat(views).extracting(AgentView::stale).containsExactly(true, false, false);
    }

    @Test
    void get_unknownWorker_throwsNotFound() {
        when(statusRepo.findById("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get("ghost"))
                .isInstanceOfSatisfying(CoordinationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CoordinationException.Kind.NOT_FOUND));
    }
}
