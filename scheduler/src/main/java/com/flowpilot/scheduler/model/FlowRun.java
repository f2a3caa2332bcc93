package com.flowpilot.scheduler.model;

/**
 * A single execution of a flow version, as seen by the scheduler.
 *
 * pauseMetadata may only be set while the run is PAUSED. tasks is null until
 * the run has finished.
 */
public record FlowRun(
        String        id,
        String        projectId,
        String        flowId,
        String        flowVersionId,
        RunEnvironment environment,
        FlowRunStatus status,
        PauseMetadata pauseMetadata,
        Integer       tasks) {

    public FlowRun {
        if (pauseMetadata != null && status != FlowRunStatus.PAUSED) {
            throw new IllegalArgumentException(
                    "pauseMetadata is only allowed on PAUSED runs, flowRunId=" + id + " status=" + status);
        }
    }

    public FlowRun withStatus(FlowRunStatus newStatus, Integer newTasks) {
        return new FlowRun(id, projectId, flowId, flowVersionId, environment, newStatus, null, newTasks);
    }

    public FlowRun paused(PauseMetadata metadata) {
        return new FlowRun(id, projectId, flowId, flowVersionId, environment, FlowRunStatus.PAUSED, metadata, tasks);
    }
}
