package com.autodev.coordinator.repository;

import com.autodev.coordinator.model.TaskStatus;

/** Row of a GROUP BY status query. */
public record StatusCount(TaskStatus status, Long count) {}
