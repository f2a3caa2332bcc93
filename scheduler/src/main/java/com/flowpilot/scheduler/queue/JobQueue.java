package com.flowpilot.scheduler.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Queue of one-time, delayed and cron-driven jobs.
 *
 * Producers only call {@link #add}; the worker loop drives the claim and
 * acknowledgement methods. Implementations must be safe for concurrent use.
 *
 * Ordering among ready jobs: priority rank, then eligibility time, then
 * insertion order.
 */
public interface JobQueue {

    /**
     * Adds or replaces the job with the same id.
     *
     * For a REPEATING job this reconfigures the schedule; there is never more
     * than one schedule per id.
     *
     * @throws com.flowpilot.scheduler.error.FlowPilotException with
     *         {@code JOB_QUEUE_FAILURE} if the job could not be stored
     */
    void add(Job job);

    /**
     * Removes the schedule of a REPEATING job.
     *
     * @return true if a schedule existed
     */
    boolean removeRepeatingJob(String jobId);

    /** Claims the next eligible job, if any. */
    Optional<ClaimedJob> claimNext(String workerId);

    /**
     * Acknowledges a successful execution. Resets the failure count of a schedule.
     * Acknowledgements of a revision that has since been replaced are ignored.
     */
    void complete(ClaimedJob job);

    /**
     * Acknowledges a failed execution.
     *
     * @return the consecutive failure count of the schedule after this failure,
     *         0 for one-time and delayed jobs and for a replaced revision
     */
    int fail(ClaimedJob job, String reason);

    /** Current schedule of a REPEATING job, including its failure count. */
    Optional<ScheduleOptions> findScheduleOptions(String jobId);

    /**
     * Makes one-time and delayed jobs claimed longer than {@code timeout} ago
     * claimable again. Their worker is presumed dead; delivery is at-least-once.
     *
     * @return number of jobs put back
     */
    int recoverStalled(Duration timeout);

    /** Number of entries currently held, ready or not. */
    long size();
}
