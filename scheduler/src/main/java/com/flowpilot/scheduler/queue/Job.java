package com.flowpilot.scheduler.queue;

import java.util.Objects;

/**
 * A unit of work handed to {@link JobQueue#add(Job)}.
 *
 * Use the factories; they enforce which fields belong to which {@link JobType}.
 */
public record Job(
        String          id,
        JobType         type,
        JobPriority     priority,
        JobData         data,
        long            delayMs,
        ScheduleOptions scheduleOptions) {

    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative, job " + id);
        }
        if (type == JobType.REPEATING && scheduleOptions == null) {
            throw new IllegalArgumentException("REPEATING job " + id + " needs scheduleOptions");
        }
        if (priority == null) {
            priority = JobPriority.MEDIUM;
        }
    }

    public static Job oneTime(String id, JobPriority priority, JobData data) {
        return new Job(id, JobType.ONE_TIME, priority, data, 0, null);
    }

    public static Job delayed(String id, long delayMs, JobData data) {
        return new Job(id, JobType.DELAYED, JobPriority.MEDIUM, data, delayMs, null);
    }

    public static Job repeating(String id, JobData data, ScheduleOptions scheduleOptions) {
        return new Job(id, JobType.REPEATING, JobPriority.MEDIUM, data, 0, scheduleOptions);
    }
}
