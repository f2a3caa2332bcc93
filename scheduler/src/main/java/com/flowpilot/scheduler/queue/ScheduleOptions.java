package com.flowpilot.scheduler.queue;

/**
 * Cron schedule of a REPEATING job.
 *
 * @param cronExpression 5-field Unix cron ("*&#47;5 * * * *") or 6-field with seconds
 * @param timezone       zone id the expression is evaluated in; always "UTC" for generated schedules
 * @param failureCount   consecutive failed executions, reset to 0 on success
 */
public record ScheduleOptions(String cronExpression, String timezone, int failureCount) {

    public static final String UTC = "UTC";

    public ScheduleOptions {
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount must not be negative");
        }
    }

    public static ScheduleOptions utc(String cronExpression) {
        return new ScheduleOptions(cronExpression, UTC, 0);
    }

    /** {@code *}{@code /N * * * *} fires every N minutes, UTC. */
    public static ScheduleOptions everyMinutes(int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Polling interval must be positive, got " + minutes);
        }
        return utc("*/" + minutes + " * * * *");
    }

    public ScheduleOptions withFailureCount(int count) {
        return new ScheduleOptions(cronExpression, timezone, count);
    }
}
