package com.autodev.coordinator.api;

import com.autodev.coordinator.api.dto.ApprovalResponse;
import com.autodev.coordinator.api.dto.DecisionRequest;
import com.autodev.coordinator.api.dto.SubmitApprovalRequest;
import com.autodev.coordinator.model.ApprovalItem;
import com.autodev.coordinator.model.ApprovalStatus;
import com.autodev.coordinator.service.ApprovalService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * The human side of the approval gate.
 *
 * GET  /approvals                — review queue, optionally filtered by status
 * GET  /approvals/{id}           — one item
 * POST /approvals                — submit an item
 * POST /approvals/{id}/decision  — approve or reject; 409 if already decided
 */
@RestController
@RequestMapping("/approvals")
public class ApprovalController {

    private final ApprovalService approvals;

    public ApprovalController(ApprovalService approvals) {
        this.approvals = approvals;
    }

    /** Without a status filter every item is listed, newest first. */
    @GetMapping
    public List<ApprovalResponse> list(@RequestParam(required = false) ApprovalStatus status,
                                       @RequestParam(defaultValue = "100") int limit) {
        return approvals.list(status, limit).stream()
                .map(ApprovalResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ApprovalResponse get(@PathVariable UUID id) {
        return ApprovalResponse.from(approvals.get(id));
    }

    @PostMapping
    public ResponseEntity<ApprovalResponse> submit(@Valid @RequestBody SubmitApprovalRequest req) {
        ApprovalItem item = approvals.submit(req.itemType(), req.reference(), req.submittedBy(),
                req.title(),
                req.context() != null ? req.context().toString() : null,
                req.followOnType());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApprovalResponse.from(item));
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/approvals/{id}/decision \
     *     -H "Content-Type: application/json" \
     *     -d '{"decision":"REJECTED","notes":"spec misses the migration plan","reviewer":"alice"}'
     */
    @PostMapping("/{id}/decision")
    public ApprovalResponse decide(@PathVariable UUID id, @Valid @RequestBody DecisionRequest req) {
        return ApprovalResponse.from(approvals.decide(id, req.decision(), req.notes(), req.reviewer()));
    }
}
