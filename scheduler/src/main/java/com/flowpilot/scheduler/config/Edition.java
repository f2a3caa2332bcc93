package com.flowpilot.scheduler.config;

/**
 * Deployment tier. Only {@link #CLOUD} is metered.
 */
public enum Edition {
    CLOUD,
    COMMUNITY,
    ENTERPRISE
}
