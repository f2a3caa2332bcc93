package com.flowpilot.scheduler.trigger;

/**
 * Decides how often a POLLING trigger runs when the trigger did not choose
 * its own schedule.
 */
public interface PollingIntervalPolicy {

    /** Minutes between two polls, always positive. */
    int pollingIntervalMinutes(String projectId);
}
