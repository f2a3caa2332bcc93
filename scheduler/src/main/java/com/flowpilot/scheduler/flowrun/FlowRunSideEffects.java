package com.flowpilot.scheduler.flowrun;

import com.flowpilot.scheduler.error.FlowPilotException;
import com.flowpilot.scheduler.model.FlowRun;
import com.flowpilot.scheduler.model.PauseMetadata;
import com.flowpilot.scheduler.model.RunEnvironment;
import com.flowpilot.scheduler.queue.Job;
import com.flowpilot.scheduler.queue.JobData;
import com.flowpilot.scheduler.queue.JobPriority;
import com.flowpilot.scheduler.queue.JobQueue;
import com.flowpilot.scheduler.queue.RepeatableJobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Optional;

/**
 * What has to happen around a flow run's state changes.
 *
 *   start  → enqueue the run (ONE_TIME, id = run id)
 *   pause  → DELAY: enqueue the resume (DELAYED, id = run id); WEBHOOK: nothing
 *   finish → usage hooks, production issue, completion broadcast
 *
 * Using the run id as job id makes a second start of the same run replace
 * the first job instead of running the flow twice.
 */
@Service
public class FlowRunSideEffects {

    private static final Logger log = LoggerFactory.getLogger(FlowRunSideEffects.class);

    private final JobQueue     jobQueue;
    private final FlowRunHooks flowRunHooks;
    private final IssueTracker issueTracker;
    private final RunNotifier  runNotifier;
    private final Clock        clock;

    public FlowRunSideEffects(JobQueue jobQueue,
                              FlowRunHooks flowRunHooks,
                              IssueTracker issueTracker,
                              RunNotifier runNotifier,
                              Clock clock) {
        this.jobQueue     = jobQueue;
        this.flowRunHooks = flowRunHooks;
        this.issueTracker = issueTracker;
        this.runNotifier  = runNotifier;
        this.clock        = clock;
    }

    /**
     * Enqueues the run. A synchronous caller is waiting when
     * synchronousHandlerId is set, so those runs jump the queue.
     *
     * @throws FlowPilotException JOB_QUEUE_FAILURE if the job could not be enqueued
     */
    public void start(StartParams params) {
        FlowRun run = params.flowRun();
        log.info("Starting flow run {} executionType={}", run.id(), params.executionType());

        JobPriority priority = params.synchronousHandlerId() == null ? JobPriority.MEDIUM : JobPriority.HIGH;
        JobData data = new JobData.ExecuteFlow(
                JobData.LATEST_SCHEMA_VERSION,
                run.id(),
                run.flowVersionId(),
                run.projectId(),
                run.environment(),
                params.executionType(),
                params.payload(),
                params.synchronousHandlerId(),
                params.hookType());
        jobQueue.add(Job.oneTime(run.id(), priority, data));
    }

    /**
     * @throws FlowPilotException VALIDATION if the run carries no pause metadata
     */
    public void pause(FlowRun run) {
        PauseMetadata pauseMetadata = run.pauseMetadata();
        log.info("Pausing flow run {} pauseType={}", run.id(),
                pauseMetadata == null ? null : pauseMetadata.type());
        if (pauseMetadata == null) {
            throw FlowPilotException.validation("pauseMetadata is undefined flowRunId=" + run.id());
        }

        Optional<Job> resumeJob = switch (pauseMetadata.type()) {
            case DELAY   -> Optional.of(delayedResume(run, (PauseMetadata.Delay) pauseMetadata));
            // Resumed by the inbound webhook, nothing to schedule.
            case WEBHOOK -> Optional.empty();
        };
        resumeJob.ifPresent(jobQueue::add);
    }

    /**
     * Runs the finish side effects in order. Issue tracking is best-effort;
     * the completion broadcast is always sent, exactly once.
     */
    public void finish(FlowRun run) {
        if (!run.status().isTerminal()) {
            log.warn("Finishing flow run {} in non-terminal status {}", run.id(), run.status());
        }
        flowRunHooks.onFinish(run.projectId(), run.tasks() == null ? 0 : run.tasks());

        if (run.environment() == RunEnvironment.PRODUCTION && run.status().isFailure()) {
            try {
                issueTracker.add(run.flowId(), run.projectId());
            } catch (RuntimeException e) {
                log.warn("Failed to record issue for flow {} (run {}): {}", run.flowId(), run.id(), e.getMessage());
            }
        }

        runNotifier.notifyRun(run);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Job delayedResume(FlowRun run, PauseMetadata.Delay delay) {
        JobData data = new JobData.Delayed(
                JobData.LATEST_SCHEMA_VERSION,
                RepeatableJobType.DELAYED_FLOW,
                run.id(),
                run.flowVersionId(),
                run.projectId(),
                run.environment());
        return Job.delayed(run.id(), delayUntil(run.id(), delay.resumeDateTime()), data);
    }

    /**
     * Milliseconds until resumeDateTime; 0 if it has already passed.
     * ISO-8601 date-times without an offset or zone are read as UTC.
     */
    private long delayUntil(String runId, String resumeDateTime) {
        if (resumeDateTime == null) {
            throw FlowPilotException.validation("resumeDateTime is undefined flowRunId=" + runId);
        }
        Instant resumeAt;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(resumeDateTime);
            resumeAt = parsed.query(TemporalQueries.zone()) != null
                    ? ZonedDateTime.from(parsed).toInstant()
                    : LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw FlowPilotException.validation(
                    "invalid resumeDateTime '" + resumeDateTime + "' flowRunId=" + runId);
        }
        long delayMs = Duration.between(clock.instant(), resumeAt).toMillis();
        return Math.max(0, delayMs);
    }
}
