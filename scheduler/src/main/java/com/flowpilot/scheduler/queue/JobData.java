package com.flowpilot.scheduler.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flowpilot.scheduler.model.ExecutionType;
import com.flowpilot.scheduler.model.RunEnvironment;
import com.flowpilot.scheduler.model.RunHookType;
import com.flowpilot.scheduler.model.TriggerType;

/**
 * Payload carried by a queued job.
 *
 * The envelope is versioned: workers reject data whose {@code schemaVersion}
 * is newer than {@link #LATEST_SCHEMA_VERSION}. The {@code kind} property
 * written by Jackson identifies the concrete record in the job table.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JobData.ExecuteFlow.class, name = "EXECUTE_FLOW"),
        @JsonSubTypes.Type(value = JobData.Repeating.class,   name = "REPEATING"),
        @JsonSubTypes.Type(value = JobData.Delayed.class,     name = "DELAYED")
})
public sealed interface JobData permits JobData.ExecuteFlow, JobData.Repeating, JobData.Delayed {

    int LATEST_SCHEMA_VERSION = 4;

    int schemaVersion();

    String projectId();

    String flowVersionId();

    /** Identifier used in logs and MDC: the run id for run jobs, the flow version id otherwise. */
    @JsonIgnore
    String correlationId();

    /**
     * Runs (or continues) a flow run. Produced by the side-effects coordinator on start.
     */
    record ExecuteFlow(
            int            schemaVersion,
            String         runId,
            String         flowVersionId,
            String         projectId,
            RunEnvironment environment,
            ExecutionType  executionType,
            Object         payload,
            String         synchronousHandlerId,
            RunHookType    hookType) implements JobData {

        @Override
        public String correlationId() {
            return runId;
        }
    }

    /**
     * Cron-driven trigger work (polling or webhook renewal).
     */
    record Repeating(
            int               schemaVersion,
            RepeatableJobType jobType,
            String            flowId,
            String            flowVersionId,
            String            projectId,
            RunEnvironment    environment,
            TriggerType       triggerType) implements JobData {

        public Repeating {
            if (jobType == RepeatableJobType.DELAYED_FLOW) {
                throw new IllegalArgumentException("DELAYED_FLOW is not a repeating job type");
            }
        }

        @Override
        public String correlationId() {
            return flowVersionId;
        }
    }

    /**
     * Resumes a run paused with a delay.
     */
    record Delayed(
            int               schemaVersion,
            RepeatableJobType jobType,
            String            runId,
            String            flowVersionId,
            String            projectId,
            RunEnvironment    environment) implements JobData {

        @Override
        public String correlationId() {
            return runId;
        }
    }
}
