package com.autodev.coordinator.model;

public enum Outcome {
    SUCCESS,
    FAILURE,
    PARTIAL
}
