package com.flowpilot.scheduler.model;

/**
 * BEGIN starts a run from its trigger output, RESUME continues a paused run.
 */
public enum ExecutionType {
    BEGIN,
    RESUME
}
