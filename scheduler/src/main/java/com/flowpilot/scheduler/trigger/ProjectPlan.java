package com.flowpilot.scheduler.trigger;

/**
 * The plan limits the scheduler consults.
 *
 * @param minimumPollingInterval minutes between two polls of the same trigger
 */
public record ProjectPlan(String projectId, int minimumPollingInterval) {}
