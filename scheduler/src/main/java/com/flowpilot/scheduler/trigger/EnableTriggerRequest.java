package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.model.FlowVersion;

import java.util.Objects;

/**
 * @param simulate true while the user is testing the trigger in the builder
 */
public record EnableTriggerRequest(FlowVersion flowVersion, String projectId, boolean simulate) {

    public EnableTriggerRequest {
        Objects.requireNonNull(flowVersion, "flowVersion");
        Objects.requireNonNull(projectId, "projectId");
    }
}
