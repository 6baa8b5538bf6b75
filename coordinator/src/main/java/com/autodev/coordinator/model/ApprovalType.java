package com.autodev.coordinator.model;

/** What a human is being asked to sign off on. */
public enum ApprovalType {
    SPEC,          // a written spec before implementation starts
    MERGE,         // a merge request before it lands
    DEPLOY,        // a release before it ships
    GENERIC_TASK   // any other task that must wait for a human
}
