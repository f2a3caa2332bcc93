package com.flowpilot.scheduler.queue.database;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.scheduler.error.ErrorCode;
import com.flowpilot.scheduler.error.FlowPilotException;
import com.flowpilot.scheduler.queue.ClaimedJob;
import com.flowpilot.scheduler.queue.CronSchedule;
import com.flowpilot.scheduler.queue.Job;
import com.flowpilot.scheduler.queue.JobData;
import com.flowpilot.scheduler.queue.JobPriority;
import com.flowpilot.scheduler.queue.JobQueue;
import com.flowpilot.scheduler.queue.JobType;
import com.flowpilot.scheduler.queue.QueueMetrics;
import com.flowpilot.scheduler.queue.ScheduleOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job queue backed by the queued_jobs table in Postgres.
 *
 * The table IS the queue: producers upsert rows, workers dequeue with
 * SELECT FOR UPDATE SKIP LOCKED. Any number of scheduler instances may share
 * one database; each claim is handed to exactly one of them.
 *
 * All public methods are @Transactional so that the locking SELECT and the
 * following UPDATE commit together.
 */
public class DatabaseJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(DatabaseJobQueue.class);

    private final QueuedJobRepository repository;
    private final ObjectMapper        mapper;
    private final Clock               clock;
    private final QueueMetrics        metrics;

    public DatabaseJobQueue(QueuedJobRepository repository, ObjectMapper mapper,
                            Clock clock, QueueMetrics metrics) {
        this.repository = repository;
        this.mapper     = mapper;
        this.clock      = clock;
        this.metrics    = metrics;
    }

    // ------------------------------------------------------------------
    // Producer side
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public void add(Job job) {
        Instant now = clock.instant();
        ScheduleOptions options = job.scheduleOptions();

        Instant availableAt = switch (job.type()) {
            case ONE_TIME  -> now;
            case DELAYED   -> now.plusMillis(job.delayMs());
            case REPEATING -> CronSchedule.of(options).nextAfter(now);
        };
        boolean repeating = job.type() == JobType.REPEATING;

        try {
            repository.upsert(
                    job.id(),
                    job.type().name(),
                    job.priority().rank(),
                    mapper.writeValueAsString(job.data()),
                    availableAt,
                    repeating ? options.cronExpression() : null,
                    repeating ? options.timezone() : null,
                    repeating ? options.failureCount() : 0,
                    now);
        } catch (JsonProcessingException e) {
            throw failure("Could not serialize data of job " + job.id(), job.id(), e);
        } catch (DataAccessException e) {
            throw failure("Could not store job " + job.id(), job.id(), e);
        }
        metrics.added(job.type());
        log.debug("Stored job {} ({}), eligible at {}", job.id(), job.type(), availableAt);
    }

    @Override
    @Transactional
    public boolean removeRepeatingJob(String jobId) {
        Optional<QueuedJob> row = repository.findById(jobId)
                .filter(j -> j.getType() == JobType.REPEATING);
        row.ifPresent(j -> {
            repository.delete(j);
            log.info("Removed schedule {}", jobId);
        });
        return row.isPresent();
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    /**
     * The lock taken by the SELECT is held until the UPDATE below commits.
     * A REPEATING row stays PENDING with available_at moved to its next firing;
     * other rows become RUNNING and are invisible to the claim query.
     */
    @Override
    @Transactional
    public Optional<ClaimedJob> claimNext(String workerId) {
        Instant now = clock.instant();
        Optional<QueuedJob> next = repository.findNextReady(QueuedJobState.PENDING, now);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        QueuedJob row = next.get();
        ScheduleOptions options = scheduleOptionsOf(row);

        if (row.getType() == JobType.REPEATING) {
            row.setAvailableAt(CronSchedule.of(options).nextAfter(now));
        } else {
            row.setState(QueuedJobState.RUNNING);
            row.setWorkerId(workerId);
            row.setClaimedAt(now);
        }
        row.setUpdatedAt(now);
        repository.save(row);

        log.info("Worker '{}' claimed job {} ({})", workerId, row.getId(), row.getType());
        metrics.claimed(row.getType());
        return Optional.of(new ClaimedJob(
                row.getId(),
                row.getType(),
                JobPriority.fromRank(row.getPriority()),
                readData(row),
                options,
                row.getRevision(),
                workerId));
    }

    @Override
    @Transactional
    public void complete(ClaimedJob job) {
        Instant now = clock.instant();
        if (job.type() == JobType.REPEATING) {
            if (repository.resetFailureCount(job.id(), job.revision(), now) == 0) {
                log.debug("Schedule {} was replaced after revision {} fired", job.id(), job.revision());
            }
            return;
        }
        if (repository.deleteByIdAndRevision(job.id(), job.revision()) == 0) {
            log.debug("Job {} was replaced after revision {} was claimed; keeping the newer entry",
                    job.id(), job.revision());
        }
    }

    @Override
    @Transactional
    public int fail(ClaimedJob job, String reason) {
        metrics.failed(job.type());
        Instant now = clock.instant();
        if (job.type() == JobType.REPEATING) {
            if (repository.incrementFailureCount(job.id(), job.revision(), now) == 0) {
                log.warn("Firing of schedule {} revision {} failed after the schedule was replaced: {}",
                        job.id(), job.revision(), reason);
                return 0;
            }
            int failures = repository.findById(job.id()).map(QueuedJob::getFailureCount).orElse(0);
            log.warn("Repeating job {} failed ({} consecutive): {}", job.id(), failures, reason);
            return failures;
        }
        repository.deleteByIdAndRevision(job.id(), job.revision());
        log.warn("Job {} ({}) failed: {}", job.id(), job.type(), reason);
        return 0;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduleOptions> findScheduleOptions(String jobId) {
        return repository.findById(jobId)
                .filter(j -> j.getType() == JobType.REPEATING)
                .map(DatabaseJobQueue::scheduleOptionsOf);
    }

    /**
     * Find RUNNING rows whose claim is older than the timeout and reset them
     * to PENDING so another worker picks them up.
     */
    @Override
    @Transactional
    public int recoverStalled(Duration timeout) {
        Instant now    = clock.instant();
        Instant cutoff = now.minus(timeout);
        List<QueuedJob> stalled = repository.findByStateAndClaimedAtBefore(QueuedJobState.RUNNING, cutoff);
        for (QueuedJob row : stalled) {
            log.warn("Job {} claimed by '{}' at {} was never acknowledged, making it claimable again",
                    row.getId(), row.getWorkerId(), row.getClaimedAt());
            row.setState(QueuedJobState.PENDING);
            row.setWorkerId(null);
            row.setClaimedAt(null);
            row.setUpdatedAt(now);
        }
        repository.saveAll(stalled);
        return stalled.size();
    }

    @Override
    @Transactional(readOnly = true)
    public long size() {
        return repository.count();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private JobData readData(QueuedJob row) {
        try {
            return mapper.readValue(row.getDataJson(), JobData.class);
        } catch (JsonProcessingException e) {
            throw failure("Could not read data of job " + row.getId(), row.getId(), e);
        }
    }

    private static ScheduleOptions scheduleOptionsOf(QueuedJob row) {
        if (row.getCronExpression() == null) {
            return null;
        }
        return new ScheduleOptions(row.getCronExpression(), row.getTimezone(), row.getFailureCount());
    }

    private static FlowPilotException failure(String message, String jobId, Throwable cause) {
        return new FlowPilotException(ErrorCode.JOB_QUEUE_FAILURE, message, Map.of("jobId", jobId), cause);
    }
}
