package com.autodev.coordinator.model;

/** What a worker last reported about itself. */
public enum AgentState {
    ONLINE,
    IDLE,
    WORKING,
    RATE_LIMITED,
    OFFLINE
}
