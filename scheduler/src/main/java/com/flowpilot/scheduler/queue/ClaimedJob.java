package com.flowpilot.scheduler.queue;

/**
 * One firing of a queued job handed to a worker.
 *
 * {@code revision} identifies the version of the queue entry that was claimed;
 * acknowledging a claim whose entry was replaced in the meantime must not
 * remove the newer entry.
 */
public record ClaimedJob(
        String          id,
        JobType         type,
        JobPriority     priority,
        JobData         data,
        ScheduleOptions scheduleOptions,
        long            revision,
        String          workerId) {}
