package com.flowpilot.scheduler.worker;

import com.flowpilot.scheduler.queue.ClaimedJob;

/**
 * Executes claimed jobs. Provided by the hosting application; without one the
 * dispatcher stays idle.
 *
 * Returning normally acknowledges the job as successful; any exception marks
 * it as failed.
 */
@FunctionalInterface
public interface JobConsumer {

    void consume(ClaimedJob job) throws Exception;
}
