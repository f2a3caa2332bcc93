package com.flowpilot.scheduler.trigger;

/**
 * How a piece trigger learns about new events.
 */
public enum TriggerStrategy {
    /** Events arrive through an app-wide webhook and are routed by account identifier. */
    APP_WEBHOOK,
    /** The trigger registers its own webhook with the third-party service. */
    WEBHOOK,
    /** The scheduler asks the trigger for new items on a cron. */
    POLLING
}
