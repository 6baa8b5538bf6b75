package com.autodev.coordinator.model;

public enum VoteStance {
    FOR,
    AGAINST
}
