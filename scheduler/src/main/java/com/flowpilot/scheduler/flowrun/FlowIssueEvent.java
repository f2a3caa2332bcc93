package com.flowpilot.scheduler.flowrun;

import java.time.Instant;

/** Spring application event published by {@link ApplicationEventIssueTracker}. */
public record FlowIssueEvent(String flowId, String projectId, Instant occurredAt) {}
