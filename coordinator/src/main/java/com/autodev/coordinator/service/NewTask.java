package com.autodev.coordinator.service;

import java.util.UUID;

/**
 * Everything a caller can say about a task it wants enqueued.
 * Only type is required; use {@link #of} and the with* methods for the rest.
 */
public record NewTask(String type,
                      int priority,
                      String payloadJson,
                      String repoRef,
                      UUID parentTaskId,
                      String createdBy,
                      String targetWorker,
                      String dedupKey,
                      UUID gateApprovalId) {

    public static final int DEFAULT_PRIORITY = 5;

    public static NewTask of(String type, int priority, String payloadJson) {
        return new NewTask(type, priority, payloadJson, null, null, null, null, null, null);
    }

    public NewTask withRepoRef(String ref) {
        return new NewTask(type, priority, payloadJson, ref, parentTaskId, createdBy, targetWorker, dedupKey, gateApprovalId);
    }

    public NewTask withParent(UUID parent) {
        return new NewTask(type, priority, payloadJson, repoRef, parent, createdBy, targetWorker, dedupKey, gateApprovalId);
    }

    public NewTask withCreatedBy(String creator) {
        return new NewTask(type, priority, payloadJson, repoRef, parentTaskId, creator, targetWorker, dedupKey, gateApprovalId);
    }

    public NewTask withTargetWorker(String worker) {
        return new NewTask(type, priority, payloadJson, repoRef, parentTaskId, createdBy, worker, dedupKey, gateApprovalId);
    }

    public NewTask withDedupKey(String key) {
        return new NewTask(type, priority, payloadJson, repoRef, parentTaskId, createdBy, targetWorker, key, gateApprovalId);
    }

    public NewTask withGate(UUID approvalId) {
        return new NewTask(type, priority, payloadJson, repoRef, parentTaskId, createdBy, targetWorker, dedupKey, approvalId);
    }
}
