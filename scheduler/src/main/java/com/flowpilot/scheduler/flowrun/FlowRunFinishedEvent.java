package com.flowpilot.scheduler.flowrun;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flowpilot.scheduler.model.FlowRun;
import com.flowpilot.scheduler.model.FlowRunStatus;
import com.flowpilot.scheduler.model.RunEnvironment;

/**
 * Broadcast on {@link #CHANNEL} when a run finishes, and re-published as a
 * Spring application event on every instance that receives it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowRunFinishedEvent(
        String         runId,
        String         flowId,
        String         projectId,
        RunEnvironment environment,
        FlowRunStatus  status,
        Integer        tasks) {

    public static final String CHANNEL = "flow-run-finished";

    public static FlowRunFinishedEvent of(FlowRun run) {
        return new FlowRunFinishedEvent(run.id(), run.flowId(), run.projectId(),
                run.environment(), run.status(), run.tasks());
    }
}
