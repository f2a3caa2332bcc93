package com.flowpilot.scheduler.engine;

import com.flowpilot.scheduler.model.FlowVersion;

/**
 * Body of POST /v1/engine/trigger-hooks.
 *
 * @param test true when the hook runs for a simulation rather than a published flow
 */
public record TriggerHookRequest(
        TriggerHookType hookType,
        FlowVersion     flowVersion,
        String          webhookUrl,
        String          projectId,
        boolean         test) {}
