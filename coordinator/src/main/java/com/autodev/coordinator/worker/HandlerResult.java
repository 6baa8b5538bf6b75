package com.autodev.coordinator.worker;

import com.autodev.coordinator.model.Outcome;

import java.time.Instant;

/**
 * What a {@link TaskHandler} reports back.
 *
 * @param resultJson       stored on the task when it completes
 * @param output           raw process output, used for error summaries
 * @param rateLimitResetAt non-null when the provider refused the work; the task is handed back
 */
public record HandlerResult(Outcome outcome, String resultJson, String output, Instant rateLimitResetAt) {

    public static HandlerResult success(String resultJson, String output) {
        return new HandlerResult(Outcome.SUCCESS, resultJson, output, null);
    }

    public static HandlerResult partial(String resultJson, String output) {
        return new HandlerResult(Outcome.PARTIAL, resultJson, output, null);
    }

    public static HandlerResult failure(String output) {
        return new HandlerResult(Outcome.FAILURE, null, output, null);
    }

    public static HandlerResult rateLimited(Instant resetAt, String output) {
        return new HandlerResult(Outcome.FAILURE, null, output, resetAt);
    }

    public boolean isRateLimited() {
        return rateLimitResetAt != null;
    }
}
