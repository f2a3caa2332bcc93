package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.config.SystemConfig;
import com.flowpilot.scheduler.config.SystemProp;
import com.flowpilot.scheduler.queue.ClaimedJob;
import com.flowpilot.scheduler.queue.JobData;
import com.flowpilot.scheduler.queue.JobQueue;
import com.flowpilot.scheduler.queue.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns off trigger schedules that keep failing.
 *
 * With the default threshold of 576 and a 5-minute poll, a trigger is
 * disabled after two days of uninterrupted failures.
 */
@Component
public class TriggerFailureThresholdPolicy {

    private static final Logger log = LoggerFactory.getLogger(TriggerFailureThresholdPolicy.class);

    private final JobQueue     jobQueue;
    private final SystemConfig config;

    public TriggerFailureThresholdPolicy(JobQueue jobQueue, SystemConfig config) {
        this.jobQueue = jobQueue;
        this.config   = config;
    }

    /**
     * Called after a failed execution was acknowledged.
     *
     * @param failureCount consecutive failures as returned by {@link JobQueue#fail}
     * @return true if the schedule was removed
     */
    public boolean onFailure(ClaimedJob job, int failureCount) {
        if (job.type() != JobType.REPEATING || !(job.data() instanceof JobData.Repeating data)) {
            return false;
        }
        int threshold = config.getNumberOrThrow(SystemProp.TRIGGER_FAILURES_THRESHOLD);
        if (failureCount < threshold) {
            return false;
        }
        boolean removed = jobQueue.removeRepeatingJob(job.id());
        log.warn("{} of flow {} (version {}) failed {} times in a row, threshold {}; schedule removed={}",
                data.jobType(), data.flowId(), data.flowVersionId(), failureCount, threshold, removed);
        return removed;
    }
}
