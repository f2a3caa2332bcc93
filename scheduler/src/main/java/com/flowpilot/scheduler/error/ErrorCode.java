package com.flowpilot.scheduler.error;

/**
 * Classifies a {@link FlowPilotException} so callers can decide whether to
 * retry, surface or just log it.
 */
public enum ErrorCode {
    /** Caller broke a contract (missing required state). Never retried. */
    VALIDATION,
    /** A required system property has no value and no default. */
    SYSTEM_PROP_NOT_DEFINED,
    /** The queue backend rejected or failed an enqueue. */
    JOB_QUEUE_FAILURE,
    /** The execution engine could not be reached or answered with a non-2xx status. */
    ENGINE_UNAVAILABLE,
    /** The piece or its trigger is not known to the metadata service. */
    PIECE_TRIGGER_NOT_FOUND
}
