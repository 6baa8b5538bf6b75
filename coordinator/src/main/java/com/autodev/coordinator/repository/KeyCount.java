package com.autodev.coordinator.repository;

/** Row of a GROUP BY query over a string column. */
public record KeyCount(String key, Long count) {}
