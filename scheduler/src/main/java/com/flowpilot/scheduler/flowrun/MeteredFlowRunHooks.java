package com.flowpilot.scheduler.flowrun;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Records the number of tasks each finished run consumed.
 *
 * <pre>
 *   flowpilot.runs.tasks   distribution summary, one sample per run
 * </pre>
 */
public class MeteredFlowRunHooks implements FlowRunHooks {

    private final DistributionSummary tasks;

    public MeteredFlowRunHooks(MeterRegistry registry) {
        this.tasks = DistributionSummary.builder("flowpilot.runs.tasks")
                .description("Tasks consumed per finished flow run")
                .register(registry);
    }

    @Override
    public void onFinish(String projectId, int taskCount) {
        tasks.record(taskCount);
    }
}
