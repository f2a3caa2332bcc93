package com.flowpilot.scheduler.model;

/**
 * Why a run is suspended and what resumes it.
 *
 * Switch on {@link #type()} rather than on the concrete class: the switch
 * expressions over {@link PauseType} are checked for exhaustiveness, so a new
 * pause type breaks every call site that has to handle it.
 */
public sealed interface PauseMetadata permits PauseMetadata.Delay, PauseMetadata.Webhook {

    PauseType type();

    /**
     * Resumed by the job queue once {@code resumeDateTime} (ISO-8601) has passed.
     */
    record Delay(String resumeDateTime) implements PauseMetadata {
        @Override
        public PauseType type() {
            return PauseType.DELAY;
        }
    }

    /**
     * Resumed by an inbound webhook carrying {@code requestId}.
     */
    record Webhook(String requestId) implements PauseMetadata {
        @Override
        public PauseType type() {
            return PauseType.WEBHOOK;
        }
    }
}
