package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.config.SystemConfig;
import com.flowpilot.scheduler.config.SystemProp;

/**
 * Self-hosted editions: one interval for every project, FP_TRIGGER_DEFAULT_POLL_INTERVAL.
 */
public class ConfiguredPollingIntervalPolicy implements PollingIntervalPolicy {

    static final int DEFAULT_INTERVAL_MINUTES = 5;

    private final SystemConfig config;

    public ConfiguredPollingIntervalPolicy(SystemConfig config) {
        this.config = config;
    }

    @Override
    public int pollingIntervalMinutes(String projectId) {
        return config.getNumber(SystemProp.TRIGGER_DEFAULT_POLL_INTERVAL)
                .filter(minutes -> minutes > 0)
                .orElse(DEFAULT_INTERVAL_MINUTES);
    }
}
