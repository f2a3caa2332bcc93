package com.flowpilot.scheduler.trigger;

/**
 * Per-project plan limits. Only consulted by the CLOUD edition.
 */
public interface PlanLimitsService {

    /** Returns the project's plan, creating the default free plan on first access. */
    ProjectPlan getOrCreateDefaultPlan(String projectId);
}
