package com.flowpilot.scheduler.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a flow run.
 *
 * Non-terminal: RUNNING, PAUSED.
 * Terminal:     SUCCEEDED, FAILED, INTERNAL_ERROR, QUOTA_EXCEEDED, TIMEOUT.
 */
public enum FlowRunStatus {
    RUNNING,
    PAUSED,
    SUCCEEDED,
    FAILED,
    INTERNAL_ERROR,
    QUOTA_EXCEEDED,
    TIMEOUT;

    private static final Set<FlowRunStatus> FAILURES =
            EnumSet.of(FAILED, INTERNAL_ERROR, QUOTA_EXCEEDED, TIMEOUT);

    public boolean isTerminal() {
        return this != RUNNING && this != PAUSED;
    }

    /** Terminal statuses that open an issue for production runs. */
    public boolean isFailure() {
        return FAILURES.contains(this);
    }
}
