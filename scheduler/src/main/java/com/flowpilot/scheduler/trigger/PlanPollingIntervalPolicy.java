package com.flowpilot.scheduler.trigger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLOUD edition: the interval is a plan limit of the project. A plan without a
 * usable minimum falls back to the configured interval.
 */
public class PlanPollingIntervalPolicy implements PollingIntervalPolicy {

    private static final Logger log = LoggerFactory.getLogger(PlanPollingIntervalPolicy.class);

    private final PlanLimitsService     planLimitsService;
    private final PollingIntervalPolicy fallback;

    public PlanPollingIntervalPolicy(PlanLimitsService planLimitsService, PollingIntervalPolicy fallback) {
        this.planLimitsService = planLimitsService;
        this.fallback          = fallback;
    }

    @Override
    public int pollingIntervalMinutes(String projectId) {
        ProjectPlan plan = planLimitsService.getOrCreateDefaultPlan(projectId);
        if (plan != null && plan.minimumPollingInterval() > 0) {
            return plan.minimumPollingInterval();
        }
        int minutes = fallback.pollingIntervalMinutes(projectId);
        log.warn("Plan of project {} has no usable minimum polling interval, using {} minute(s)",
                projectId, minutes);
        return minutes;
    }
}
