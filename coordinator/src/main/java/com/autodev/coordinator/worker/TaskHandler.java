package com.autodev.coordinator.worker;

import com.autodev.coordinator.model.Task;

/**
 * Does the actual work of a claimed task. The coordination core treats it
 * as a black box: it only sees the returned {@link HandlerResult}.
 */
public interface TaskHandler {

    /**
     * @param provider LLM provider chosen for this run
     * @param context  markdown block of learnings and recent failures, possibly empty
     */
    HandlerResult execute(Task task, String provider, String context) throws Exception;
}
