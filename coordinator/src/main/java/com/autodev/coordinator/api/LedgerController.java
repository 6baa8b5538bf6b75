package com.autodev.coordinator.api;

import com.autodev.coordinator.api.dto.LearningResponse;
import com.autodev.coordinator.service.OutcomeLedgerService;
import com.autodev.coordinator.service.OutcomeStats;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

/**
 * GET /outcomes/stats  — success rates per worker and per task type
 * GET /learnings       — learnings, most validated first (optionally for one worker)
 */
@RestController
public class LedgerController {

    private final OutcomeLedgerService ledger;

    public LedgerController(OutcomeLedgerService ledger) {
        this.ledger = ledger;
    }

    @GetMapping("/outcomes/stats")
    public OutcomeStats stats(@RequestParam(defaultValue = "24") int windowHours) {
        return ledger.aggregate(Duration.ofHours(Math.max(1, windowHours)));
    }

    @GetMapping("/learnings")
    public List<LearningResponse> learnings(@RequestParam(required = false) String worker,
                                            @RequestParam(defaultValue = "50") int limit) {
        return (worker == null ? ledger.allLearnings(limit) : ledger.learningsFor(worker, limit)).stream()
                .map(LearningResponse::from)
                .toList();
    }
}
