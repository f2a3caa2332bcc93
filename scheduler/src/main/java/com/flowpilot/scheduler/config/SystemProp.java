package com.flowpilot.scheduler.config;

/**
 * Logical configuration keys with their static defaults.
 *
 * The effective value of a key is read from the property {@code FP_<NAME>}
 * (environment variable, JVM system property or application.yml) and falls
 * back to the default declared here. A {@code null} default means the key
 * is optional.
 */
public enum SystemProp {

    EDITION("COMMUNITY"),
    QUEUE_MODE("DISTRIBUTED"),
    CONTAINER_TYPE("WORKER_AND_APP"),

    TRIGGER_DEFAULT_POLL_INTERVAL("5"),
    TRIGGER_TIMEOUT_SECONDS("60"),
    TRIGGER_FAILURES_THRESHOLD("576"),

    FLOW_WORKER_CONCURRENCY("10"),
    FLOW_TIMEOUT_SECONDS("600"),

    WEBHOOK_URL("http://localhost:8080/api"),
    ENGINE_URL("http://localhost:3000"),

    LOG_LEVEL("info"),
    LOG_PRETTY("false"),

    // Optional, no default.
    REDIS_CHANNEL_PREFIX(null);

    private final String defaultValue;

    SystemProp(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    public String defaultValue() {
        return defaultValue;
    }

    /** Name of the property/environment variable that overrides the default. */
    public String envName() {
        return "FP_" + name();
    }
}
